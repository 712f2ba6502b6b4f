package com.reprise.service;

import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheSettings;
import com.reprise.model.CacheStats;
import com.reprise.model.PerformanceMetrics;
import com.reprise.model.dto.CacheEntrySummary;
import com.reprise.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Admin service for cache browsing and analytics.
 */
@Slf4j
@Service
public class AdminService {

    private static final int PROMPT_PREVIEW_LENGTH = 100;

    private final ResponseCacheStore cacheStore;
    private final RepriseProperties properties;

    public AdminService(ResponseCacheStore cacheStore, RepriseProperties properties) {
        this.cacheStore = cacheStore;
        this.properties = properties;
    }

    /**
     * List entries.
     *
     * @param view  "recent", "frequent" or "all"
     * @param limit maximum number of entries (ignored for "all")
     */
    public List<CacheEntrySummary> getEntries(String view, int limit) {
        List<CacheEntry> entries;
        switch (view == null ? "recent" : view.toLowerCase(Locale.ROOT)) {
            case "frequent":
                entries = cacheStore.getMostFrequentEntries(limit);
                break;
            case "all":
                entries = cacheStore.getAllEntries();
                break;
            case "recent":
                entries = cacheStore.getRecentlyAccessedEntries(limit);
                break;
            default:
                throw new IllegalArgumentException("Unknown entry view: " + view);
        }

        return entries.stream()
                .map(this::toSummary)
                .collect(Collectors.toList());
    }

    /**
     * Delete a specific cache entry.
     *
     * @return true if the entry existed
     */
    public boolean deleteEntry(String id) {
        boolean deleted = cacheStore.deleteEntry(id);
        log.info("Deleted cache entry: id={}, found={}", id, deleted);
        return deleted;
    }

    public void clearAllCache() {
        cacheStore.clearCache();
        log.warn("Cleared all cache entries");
    }

    /**
     * Get comprehensive cache statistics.
     */
    public CacheStatistics getStatistics() {
        double costRate = properties.getCache().getCostPerThousandTokens();
        CacheStats stats = cacheStore.getStats();
        PerformanceMetrics metrics = cacheStore.getPerformanceMetrics(costRate);
        CacheSettings settings = cacheStore.getSettings();

        return CacheStatistics.builder()
                .totalEntries(stats.getTotalEntries())
                .totalHits(stats.getTotalHits())
                .totalMisses(stats.getTotalMisses())
                .hitRate(metrics.getHitRate())
                .tokensSaved(stats.getEstimatedSavings())
                .costSavings(metrics.getEstimatedCostSavings())
                .cacheSizeBytes(stats.getCacheSize())
                .cacheSize(cacheStore.getFormattedCacheSize())
                .avgAccessCount(metrics.getAvgAccessCount())
                .medianAccessCount(metrics.getMedianAccessCount())
                .cacheEfficiency(metrics.getCacheEfficiency())
                .enabled(settings.isEnabled())
                .maxEntries(settings.getMaxEntries())
                .maxAgeDays(settings.getMaxAgeDays())
                .build();
    }

    private CacheEntrySummary toSummary(CacheEntry entry) {
        String prompt = entry.getPrompt() != null ? entry.getPrompt() : "";
        String preview = prompt.length() > PROMPT_PREVIEW_LENGTH
                ? prompt.substring(0, PROMPT_PREVIEW_LENGTH) + "..."
                : prompt;

        return CacheEntrySummary.builder()
                .id(entry.getId())
                .model(entry.getModel())
                .temperature(entry.getTemperature())
                .promptPreview(preview)
                .responseLength(entry.getResponse() != null ? entry.getResponse().length() : 0)
                .tokensUsed(entry.getTokensUsed())
                .accessCount(entry.getAccessCount())
                .createdAt(entry.getCreatedAt())
                .accessedAt(entry.getAccessedAt())
                .build();
    }
}
