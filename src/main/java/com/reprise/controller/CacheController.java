package com.reprise.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheSettings;
import com.reprise.model.CacheSettingsPatch;
import com.reprise.model.CacheSnapshot;
import com.reprise.model.CacheStats;
import com.reprise.model.PerformanceMetrics;
import com.reprise.service.CacheSnapshotCodec;
import com.reprise.service.InvalidSettingsException;
import com.reprise.service.ResponseCacheStore;
import com.reprise.service.SnapshotFormatException;
import com.reprise.service.SnapshotService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Cache management controller.
 * Provides statistics, settings, maintenance and export/import for the response cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCacheStore cacheStore;
    private final CacheSnapshotCodec snapshotCodec;
    private final SnapshotService snapshotService;
    private final RepriseProperties properties;

    public CacheController(
            ResponseCacheStore cacheStore,
            CacheSnapshotCodec snapshotCodec,
            SnapshotService snapshotService,
            RepriseProperties properties) {
        this.cacheStore = cacheStore;
        this.snapshotCodec = snapshotCodec;
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        CacheStats stats = cacheStore.getStats();

        return ResponseEntity.ok(Map.of(
                "total_entries", stats.getTotalEntries(),
                "total_hits", stats.getTotalHits(),
                "total_misses", stats.getTotalMisses(),
                "estimated_savings", stats.getEstimatedSavings(),
                "cache_size", stats.getCacheSize(),
                "cache_size_formatted", cacheStore.getFormattedCacheSize(),
                "hit_rate", cacheStore.getHitRate(),
                "status", cacheStore.isEnabled() ? "enabled" : "disabled"
        ));
    }

    @GetMapping("/metrics")
    public ResponseEntity<PerformanceMetrics> getMetrics() {
        return ResponseEntity.ok(cacheStore.getPerformanceMetrics(properties.getCache().getCostPerThousandTokens()));
    }

    @GetMapping("/settings")
    public ResponseEntity<CacheSettings> getSettings() {
        return ResponseEntity.ok(cacheStore.getSettings());
    }

    /**
     * Update settings. Shrinking maxEntries evicts least recently used entries immediately.
     */
    @PatchMapping("/settings")
    public ResponseEntity<CacheSettings> updateSettings(@RequestBody CacheSettingsPatch patch) {
        log.info("Cache settings update requested: {}", patch);
        cacheStore.updateSettings(patch);
        return ResponseEntity.ok(cacheStore.getSettings());
    }

    /**
     * Clear all cache entries. Counters are kept.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cacheStore.clearCache();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared"
        ));
    }

    @PostMapping("/stats/reset")
    public ResponseEntity<Map<String, String>> resetStats() {
        cacheStore.resetStats();
        return ResponseEntity.ok(Map.of("status", "success"));
    }

    @PostMapping("/optimize")
    public ResponseEntity<Map<String, Integer>> optimize() {
        return ResponseEntity.ok(Map.of("evicted", cacheStore.optimize()));
    }

    @PostMapping("/clean-expired")
    public ResponseEntity<Map<String, Integer>> cleanExpired() {
        return ResponseEntity.ok(Map.of("removed", cacheStore.cleanExpired()));
    }

    /**
     * Remove every entry whose prompt contains the given text.
     */
    @PostMapping("/invalidate")
    public ResponseEntity<Map<String, Integer>> invalidate(@RequestParam String contains) {
        return ResponseEntity.ok(Map.of("removed", cacheStore.invalidateByContext(contains)));
    }

    @GetMapping("/prefetch")
    public ResponseEntity<List<CacheEntry>> prefetch(
            @RequestParam String prompt,
            @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(cacheStore.getPrefetchCandidates(prompt, limit));
    }

    @GetMapping("/export")
    public ResponseEntity<CacheSnapshot> exportCache() {
        return ResponseEntity.ok(cacheStore.exportCache());
    }

    /**
     * Import a snapshot. Unreadable entries are skipped; a non-object body is rejected.
     */
    @PostMapping("/import")
    public ResponseEntity<Map<String, Object>> importCache(@RequestBody JsonNode body) {
        cacheStore.importCache(snapshotCodec.decode(body));

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "entries", cacheStore.getStats().getTotalEntries()
        ));
    }

    @PostMapping("/snapshot/save")
    public ResponseEntity<Map<String, Object>> saveSnapshot() {
        return ResponseEntity.ok(Map.of(
                "available", snapshotService.isAvailable(),
                "saved", snapshotService.saveSnapshot()
        ));
    }

    @PostMapping("/snapshot/restore")
    public ResponseEntity<Map<String, Object>> restoreSnapshot() {
        return ResponseEntity.ok(Map.of(
                "available", snapshotService.isAvailable(),
                "restored", snapshotService.restoreSnapshot()
        ));
    }

    @DeleteMapping("/snapshot")
    public ResponseEntity<Map<String, Object>> deleteSnapshot() {
        return ResponseEntity.ok(Map.of("deleted", snapshotService.deleteSnapshot()));
    }

    @ExceptionHandler({InvalidSettingsException.class, SnapshotFormatException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        log.warn("Rejected cache request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "status", "error",
                "message", e.getMessage()
        ));
    }
}
