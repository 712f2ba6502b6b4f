package com.reprise.service;

import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheSettings;
import com.reprise.model.CacheSettingsPatch;
import com.reprise.model.CacheSnapshot;
import com.reprise.model.CacheStats;
import com.reprise.model.CacheWrite;
import com.reprise.model.CompletionRequest;
import com.reprise.model.PerformanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory response cache with TTL expiration, LRU eviction at hard capacity
 * and value-scored pruning above a soft threshold.
 *
 * All public operations run under the instance monitor, because lookups mutate
 * access metadata and eviction mutates the table while iterating it.
 * Entries handed out are always copies.
 */
@Slf4j
public class ResponseCacheStore {

    /**
     * Fixed per-entry metadata overhead used for the approximate size.
     */
    static final int ENTRY_OVERHEAD_BYTES = 200;

    public static final double DEFAULT_COST_PER_THOUSAND_TOKENS = 0.002;

    private static final double SECONDS_PER_DAY = 24 * 60 * 60;

    // optimize()
    private static final double SOFT_CAPACITY_RATIO = 0.8;
    private static final double OVER_EVICTION_FACTOR = 1.2;
    private static final double RECENCY_WEIGHT = 0.4;
    private static final double POPULARITY_WEIGHT = 0.4;
    private static final double SIZE_WEIGHT = 0.2;

    // getPrefetchCandidates()
    private static final double PREFETCH_MIN_SCORE = 0.3;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CacheKeyGenerator keyGenerator;
    private final Clock clock;
    private final IdGenerator idGenerator;

    // Insertion order decides LRU ties
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final CacheStats stats = new CacheStats();
    private CacheSettings settings;

    public ResponseCacheStore(
            CacheSettings settings,
            CacheKeyGenerator keyGenerator,
            Clock clock,
            IdGenerator idGenerator) {
        List<String> problems = settings.violations();
        if (!problems.isEmpty()) {
            throw new InvalidSettingsException(String.join("; ", problems));
        }
        this.settings = settings.copy();
        this.keyGenerator = keyGenerator;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * Derive the key for a request.
     */
    public CacheKey deriveKey(String prompt, String context, String model, double temperature) {
        return keyGenerator.deriveKey(prompt, context, model, temperature);
    }

    /**
     * Look up a cached response.
     *
     * An expired entry is removed as part of the lookup and counts as a miss.
     * When the cache is disabled nothing is counted.
     *
     * @return copy of the entry on a hit
     */
    public synchronized Optional<CacheEntry> get(String prompt, String context, String model, double temperature) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }

        String key = deriveKey(prompt, context, model, temperature).asString();
        CacheEntry entry = entries.get(key);

        if (entry == null) {
            stats.setTotalMisses(stats.getTotalMisses() + 1);
            log.debug("Cache MISS: key={}", key);
            return Optional.empty();
        }

        Instant now = clock.instant();
        if (isExpired(entry, now)) {
            entries.remove(key);
            refreshStats();
            stats.setTotalMisses(stats.getTotalMisses() + 1);
            log.debug("Cache MISS (expired): key={}, id={}", key, entry.getId());
            return Optional.empty();
        }

        entry.setAccessedAt(now);
        entry.setAccessCount(entry.getAccessCount() + 1);
        stats.setTotalHits(stats.getTotalHits() + 1);
        stats.setEstimatedSavings(stats.getEstimatedSavings() + entry.getTokensUsed());

        log.debug("Cache HIT: key={}, id={}, access_count={}", key, entry.getId(), entry.getAccessCount());
        return Optional.of(entry.copy());
    }

    /**
     * Store a response with no input/output token breakdown.
     */
    public CacheEntry set(
            String prompt,
            String context,
            String model,
            double temperature,
            String response,
            int tokensUsed) {
        return set(prompt, context, model, temperature, response, tokensUsed, 0, 0);
    }

    /**
     * Store a response.
     *
     * At hard capacity exactly one entry, the least recently accessed, is evicted first.
     * When the cache is disabled a well-formed entry is returned but not stored.
     *
     * @return copy of the new entry
     */
    public synchronized CacheEntry set(
            String prompt,
            String context,
            String model,
            double temperature,
            String response,
            int tokensUsed,
            int inputTokens,
            int outputTokens) {
        CacheKey key = deriveKey(prompt, context, model, temperature);
        CacheEntry entry = createEntry(key, prompt, model, temperature, response, tokensUsed, inputTokens, outputTokens);

        if (!settings.isEnabled()) {
            log.debug("Cache disabled, not storing: key={}", key);
            return entry;
        }
        return store(key, entry);
    }

    /**
     * Store a response only if the cache is enabled at the time of the call.
     *
     * @return copy of the stored entry, empty when the cache is disabled
     */
    public synchronized Optional<CacheEntry> setIfEnabled(
            String prompt,
            String context,
            String model,
            double temperature,
            String response,
            int tokensUsed,
            int inputTokens,
            int outputTokens) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        CacheKey key = deriveKey(prompt, context, model, temperature);
        return Optional.of(store(key,
                createEntry(key, prompt, model, temperature, response, tokensUsed, inputTokens, outputTokens)));
    }

    private CacheEntry store(CacheKey key, CacheEntry entry) {
        if (entries.size() >= settings.getMaxEntries()) {
            evictLeastRecentlyUsed();
        }

        entries.put(key.asString(), entry);
        refreshStats();

        log.debug("Stored in cache: key={}, id={}", key, entry.getId());
        return entry.copy();
    }

    /**
     * Batch lookup. Only hits appear in the result, keyed by cache key.
     */
    public synchronized Map<String, CacheEntry> batchGet(List<CompletionRequest> queries) {
        Map<String, CacheEntry> results = new LinkedHashMap<>();
        for (CompletionRequest query : queries) {
            get(query.getPrompt(), query.getContext(), query.getModel(), query.getTemperature())
                    .ifPresent(entry -> results.put(
                            deriveKey(query.getPrompt(), query.getContext(), query.getModel(), query.getTemperature())
                                    .asString(),
                            entry));
        }
        return results;
    }

    /**
     * Batch store.
     *
     * @return number of writes processed
     */
    public synchronized int batchSet(List<CacheWrite> writes) {
        int count = 0;
        for (CacheWrite write : writes) {
            set(write.getPrompt(), write.getContext(), write.getModel(), write.getTemperature(),
                    write.getResponse(), write.getTokensUsed(), write.getInputTokens(), write.getOutputTokens());
            count++;
        }
        return count;
    }

    /**
     * Value-scored pruning. Runs only when the live count exceeds 80% of capacity,
     * then evicts the lowest-value entries, 20% beyond what the threshold requires.
     *
     * @return number of entries evicted
     */
    public synchronized int optimize() {
        double softThreshold = settings.getMaxEntries() * SOFT_CAPACITY_RATIO;
        int liveCount = entries.size();
        if (liveCount <= softThreshold) {
            return 0;
        }

        Instant now = clock.instant();
        List<ScoredKey> scored = entries.entrySet().stream()
                .map(e -> new ScoredKey(e.getKey(), valueScore(e.getValue(), now)))
                .sorted(Comparator.comparingDouble(ScoredKey::score))
                .collect(Collectors.toList());

        int toEvict = (int) Math.floor((liveCount - softThreshold) * OVER_EVICTION_FACTOR);
        int evicted = 0;
        for (int i = 0; i < toEvict && i < scored.size(); i++) {
            entries.remove(scored.get(i).key());
            evicted++;
        }

        refreshStats();
        log.info("Optimized cache: evicted {} of {} entries (soft threshold {})", evicted, liveCount, softThreshold);
        return evicted;
    }

    /**
     * Value in roughly [0, 1]: recency 0.4, popularity 0.4, size 0.2.
     */
    double valueScore(CacheEntry entry, Instant now) {
        Duration age = Duration.between(entry.getAccessedAt(), now);
        double ageDays = (age.getSeconds() + age.getNano() / 1_000_000_000.0) / SECONDS_PER_DAY;
        double recencyScore = 1.0 / (1.0 + ageDays);
        double popularityScore = Math.min(entry.getAccessCount() / 100.0, 1.0);
        double sizeScore = 1.0 / (1.0 + lengthOf(entry.getResponse()) / 1000.0);
        return recencyScore * RECENCY_WEIGHT + popularityScore * POPULARITY_WEIGHT + sizeScore * SIZE_WEIGHT;
    }

    /**
     * Entries likely to be requested next, ranked by word overlap with the current
     * prompt weighted by popularity. Scores at or below 0.3 are dropped.
     */
    public synchronized List<CacheEntry> getPrefetchCandidates(String currentPrompt, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        Set<String> currentWords = words(currentPrompt);
        List<ScoredEntry> candidates = new ArrayList<>();

        for (CacheEntry entry : entries.values()) {
            Set<String> entryWords = words(entry.getPrompt());
            long overlap = currentWords.stream().filter(entryWords::contains).count();
            double score = ((double) overlap / Math.max(currentWords.size(), 1)) * (entry.getAccessCount() / 10.0);
            if (score > PREFETCH_MIN_SCORE) {
                candidates.add(new ScoredEntry(entry, score));
            }
        }

        return candidates.stream()
                .sorted(Comparator.comparingDouble(ScoredEntry::score).reversed())
                .limit(limit)
                .map(candidate -> candidate.entry().copy())
                .collect(Collectors.toList());
    }

    private static Set<String> words(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(WHITESPACE.split(text.toLowerCase(Locale.ROOT)))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * Remove every entry older than maxAgeDays.
     *
     * @return number removed
     */
    public synchronized int cleanExpired() {
        Instant now = clock.instant();
        int removed = removeIf(entry -> isExpired(entry, now));
        if (removed > 0) {
            log.info("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * Remove every entry whose prompt contains the given text.
     *
     * @return number removed
     */
    public synchronized int invalidateByContext(String substring) {
        if (substring == null) {
            return 0;
        }
        int removed = removeIf(entry -> entry.getPrompt() != null && entry.getPrompt().contains(substring));
        log.debug("Invalidated {} cache entries by context", removed);
        return removed;
    }

    /**
     * Delete one entry by id.
     *
     * @return true if an entry was removed
     */
    public synchronized boolean deleteEntry(String entryId) {
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (Objects.equals(it.next().getId(), entryId)) {
                it.remove();
                refreshStats();
                log.debug("Deleted cache entry: id={}", entryId);
                return true;
            }
        }
        return false;
    }

    /**
     * Drop all entries. Hit/miss counters are kept.
     */
    public synchronized void clearCache() {
        int size = entries.size();
        entries.clear();
        refreshStats();
        log.info("Cleared {} cache entries", size);
    }

    /**
     * Zero hit, miss and savings counters. Entries are kept.
     */
    public synchronized void resetStats() {
        stats.setTotalHits(0);
        stats.setTotalMisses(0);
        stats.setEstimatedSavings(0);
    }

    public synchronized CacheStats getStats() {
        CacheStats copy = stats.copy();
        copy.setTotalEntries(entries.size());
        return copy;
    }

    public synchronized CacheSettings getSettings() {
        return settings.copy();
    }

    public synchronized boolean isEnabled() {
        return settings.isEnabled();
    }

    public void setEnabled(boolean enabled) {
        updateSettings(CacheSettingsPatch.builder().enabled(enabled).build());
    }

    /**
     * Apply a validated settings patch. If capacity shrinks below the live count,
     * least recently used entries are evicted until the table conforms.
     *
     * @throws InvalidSettingsException if the patch is out of range; settings stay unchanged
     */
    public synchronized void updateSettings(CacheSettingsPatch patch) {
        settings = patch.applyTo(settings);
        int evicted = enforceCapacity();
        refreshStats();
        log.info("Updated cache settings: {} (evicted {})", settings, evicted);
    }

    /**
     * All entries, most recently accessed first.
     */
    public synchronized List<CacheEntry> getAllEntries() {
        return entries.values().stream()
                .sorted(Comparator.comparing(CacheEntry::getAccessedAt).reversed())
                .map(CacheEntry::copy)
                .collect(Collectors.toList());
    }

    public synchronized List<CacheEntry> getMostFrequentEntries(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparingInt(CacheEntry::getAccessCount).reversed())
                .limit(Math.max(limit, 0))
                .map(CacheEntry::copy)
                .collect(Collectors.toList());
    }

    public synchronized List<CacheEntry> getRecentlyAccessedEntries(int limit) {
        return entries.values().stream()
                .sorted(Comparator.comparing(CacheEntry::getAccessedAt).reversed())
                .limit(Math.max(limit, 0))
                .map(CacheEntry::copy)
                .collect(Collectors.toList());
    }

    /**
     * Hit rate as a percentage, 0 without any activity.
     */
    public synchronized double getHitRate() {
        long total = stats.getTotalHits() + stats.getTotalMisses();
        if (total == 0) {
            return 0.0;
        }
        return (double) stats.getTotalHits() / total * 100.0;
    }

    public double getEstimatedCostSavings() {
        return getEstimatedCostSavings(DEFAULT_COST_PER_THOUSAND_TOKENS);
    }

    public synchronized double getEstimatedCostSavings(double costPerThousandTokens) {
        return stats.getEstimatedSavings() / 1000.0 * costPerThousandTokens;
    }

    /**
     * Approximate size for display, e.g. "512 B", "1.5 KB", "2.0 MB".
     */
    public synchronized String getFormattedCacheSize() {
        long bytes = stats.getCacheSize();
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return getPerformanceMetrics(DEFAULT_COST_PER_THOUSAND_TOKENS);
    }

    /**
     * Recompute performance metrics from the live table and counters.
     */
    public synchronized PerformanceMetrics getPerformanceMetrics(double costPerThousandTokens) {
        int[] accessCounts = entries.values().stream()
                .mapToInt(CacheEntry::getAccessCount)
                .sorted()
                .toArray();

        double avgAccessCount = accessCounts.length > 0 ? Arrays.stream(accessCounts).average().orElse(0.0) : 0.0;
        int medianAccessCount = accessCounts.length > 0 ? accessCounts[accessCounts.length / 2] : 0;
        double cacheEfficiency = accessCounts.length > 0
                ? (double) stats.getTotalHits() / accessCounts.length
                : 0.0;

        return PerformanceMetrics.builder()
                .hitRate(getHitRate())
                .avgAccessCount(avgAccessCount)
                .medianAccessCount(medianAccessCount)
                .totalSavings(stats.getEstimatedSavings())
                .estimatedCostSavings(getEstimatedCostSavings(costPerThousandTokens))
                .cacheEfficiency(cacheEfficiency)
                .build();
    }

    /**
     * Snapshot of entries (most recently accessed first), stats and settings. No side effects.
     */
    public synchronized CacheSnapshot exportCache() {
        return CacheSnapshot.builder()
                .entries(getAllEntries())
                .stats(getStats())
                .settings(getSettings())
                .build();
    }

    /**
     * Restore from a snapshot.
     *
     * Settings are replaced when present (out-of-range fields fall back to defaults),
     * counters are replaced when present, and the table is rebuilt from the entry list
     * in input order: malformed or already-expired entries are skipped, and input is
     * truncated once the table reaches capacity.
     */
    public synchronized void importCache(CacheSnapshot data) {
        if (data == null) {
            return;
        }

        if (data.getSettings() != null) {
            List<String> problems = data.getSettings().violations();
            if (!problems.isEmpty()) {
                log.warn("Imported settings out of range, using defaults for: {}", problems);
            }
            settings = data.getSettings().sanitized();
        }

        if (data.getStats() != null) {
            stats.setTotalHits(data.getStats().getTotalHits());
            stats.setTotalMisses(data.getStats().getTotalMisses());
            stats.setEstimatedSavings(data.getStats().getEstimatedSavings());
        }

        if (data.getEntries() != null) {
            entries.clear();
            Instant now = clock.instant();
            int malformed = 0;
            int expired = 0;
            int truncated = 0;

            List<CacheEntry> incoming = data.getEntries();
            for (int i = 0; i < incoming.size(); i++) {
                if (entries.size() >= settings.getMaxEntries()) {
                    truncated = incoming.size() - i;
                    break;
                }

                CacheEntry candidate = incoming.get(i);
                if (!isWellFormed(candidate)) {
                    malformed++;
                    continue;
                }
                CacheEntry restored = normalize(candidate, now);
                if (isExpired(restored, now)) {
                    expired++;
                    continue;
                }

                CacheKey key = keyGenerator.keyOf(restored);
                restored.setPromptHash(key.promptHash());
                restored.setContextHash(key.contextHash());
                entries.put(key.asString(), restored);
            }

            if (malformed > 0) {
                log.warn("Skipped {} malformed cache entries during import", malformed);
            }
            log.info("Imported {} cache entries (expired={}, malformed={}, truncated={})",
                    entries.size(), expired, malformed, truncated);
        }

        enforceCapacity();
        refreshStats();
    }

    private CacheEntry createEntry(
            CacheKey key,
            String prompt,
            String model,
            double temperature,
            String response,
            int tokensUsed,
            int inputTokens,
            int outputTokens) {
        Instant now = clock.instant();
        return CacheEntry.builder()
                .id(idGenerator.generateId().toString())
                .promptHash(key.promptHash())
                .contextHash(key.contextHash())
                .prompt(prompt)
                .response(response)
                .model(model)
                .temperature(temperature)
                .tokensUsed(tokensUsed)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .createdAt(now)
                .accessedAt(now)
                .accessCount(1)
                .build();
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.getCreatedAt(), now).compareTo(Duration.ofDays(settings.getMaxAgeDays())) > 0;
    }

    private static boolean isWellFormed(CacheEntry entry) {
        return entry != null
                && entry.getId() != null && !entry.getId().isBlank()
                && entry.getPrompt() != null
                && entry.getResponse() != null
                && entry.getModel() != null
                && entry.getCreatedAt() != null;
    }

    /**
     * Copy of an imported entry with its timestamps clamped to
     * {@code createdAt <= accessedAt <= now} and a positive access count.
     */
    private static CacheEntry normalize(CacheEntry entry, Instant now) {
        CacheEntry restored = entry.copy();
        if (restored.getCreatedAt().isAfter(now)) {
            log.debug("Imported entry created in the future, clamping: id={}, createdAt={}",
                    restored.getId(), restored.getCreatedAt());
            restored.setCreatedAt(now);
        }
        if (restored.getAccessedAt() == null || restored.getAccessedAt().isBefore(restored.getCreatedAt())) {
            restored.setAccessedAt(restored.getCreatedAt());
        } else if (restored.getAccessedAt().isAfter(now)) {
            restored.setAccessedAt(now);
        }
        if (restored.getAccessCount() < 1) {
            restored.setAccessCount(1);
        }
        return restored;
    }

    /**
     * Evict the entry with the smallest accessedAt; the first one encountered wins ties.
     */
    private void evictLeastRecentlyUsed() {
        String oldestKey = null;
        Instant oldestTime = null;

        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            Instant accessedAt = e.getValue().getAccessedAt();
            if (oldestTime == null || accessedAt.isBefore(oldestTime)) {
                oldestTime = accessedAt;
                oldestKey = e.getKey();
            }
        }

        if (oldestKey != null) {
            CacheEntry evicted = entries.remove(oldestKey);
            log.debug("Evicted LRU entry: key={}, id={}", oldestKey, evicted.getId());
        }
    }

    private int enforceCapacity() {
        int evicted = 0;
        while (entries.size() > settings.getMaxEntries()) {
            evictLeastRecentlyUsed();
            evicted++;
        }
        return evicted;
    }

    private int removeIf(Predicate<CacheEntry> condition) {
        int before = entries.size();
        entries.values().removeIf(condition);
        int removed = before - entries.size();
        refreshStats();
        return removed;
    }

    private void refreshStats() {
        long size = 0;
        for (CacheEntry entry : entries.values()) {
            size += lengthOf(entry.getPrompt()) + lengthOf(entry.getResponse()) + ENTRY_OVERHEAD_BYTES;
        }
        stats.setTotalEntries(entries.size());
        stats.setCacheSize(size);
    }

    private static int lengthOf(String text) {
        return text == null ? 0 : text.length();
    }

    private record ScoredKey(String key, double score) {
    }

    private record ScoredEntry(CacheEntry entry, double score) {
    }
}
