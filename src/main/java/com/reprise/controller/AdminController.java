package com.reprise.controller;

import com.reprise.model.dto.CacheEntrySummary;
import com.reprise.model.dto.CacheStatistics;
import com.reprise.service.AdminService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Admin API for cache browsing and analytics.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin/cache")
public class AdminController {

    private final AdminService adminService;

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    /**
     * List cache entries.
     *
     * @param view  recent (by last access), frequent (by access count) or all
     * @param limit maximum entries for recent/frequent
     * @return entry summaries
     */
    @GetMapping("/entries")
    public ResponseEntity<List<CacheEntrySummary>> getEntries(
            @RequestParam(defaultValue = "recent") String view,
            @RequestParam(defaultValue = "20") int limit) {

        log.info("Admin: Listing cache entries - view={}, limit={}", view, limit);
        return ResponseEntity.ok(adminService.getEntries(view, limit));
    }

    /**
     * Delete a specific cache entry.
     *
     * @param id Cache entry ID
     * @return 204 No Content on success, 404 if unknown
     */
    @DeleteMapping("/entries/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable String id) {
        log.info("Admin: Deleting cache entry id={}", id);

        if (!adminService.deleteEntry(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Clear all cache entries.
     * WARNING: This is destructive!
     *
     * @param confirm Must be "yes" to proceed
     * @return 204 No Content on success
     */
    @DeleteMapping("/clear")
    public ResponseEntity<?> clearCache(@RequestParam String confirm) {
        if (!"yes".equals(confirm)) {
            return ResponseEntity.badRequest()
                    .body("Must provide confirm=yes to clear cache");
        }

        log.warn("Admin: Clearing ALL cache entries");
        adminService.clearAllCache();

        return ResponseEntity.noContent().build();
    }

    /**
     * Get cache statistics including hit rate, cost savings and access distribution.
     */
    @GetMapping("/statistics")
    public ResponseEntity<CacheStatistics> getStatistics() {
        log.info("Admin: Getting cache statistics");
        return ResponseEntity.ok(adminService.getStatistics());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", e.getMessage()
        ));
    }
}
