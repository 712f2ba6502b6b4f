package com.reprise.config;

import com.reprise.model.CacheSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for Reprise.
 */
@Data
@Component
@ConfigurationProperties(prefix = "reprise")
public class RepriseProperties {

    private CacheConfig cache = new CacheConfig();
    private MaintenanceConfig maintenance = new MaintenanceConfig();
    private SnapshotConfig snapshot = new SnapshotConfig();

    @Data
    public static class CacheConfig {
        private boolean enabled = CacheSettings.DEFAULT_ENABLED;
        private int maxEntries = CacheSettings.DEFAULT_MAX_ENTRIES;
        private int maxAgeDays = CacheSettings.DEFAULT_MAX_AGE_DAYS;
        private double matchThreshold = CacheSettings.DEFAULT_MATCH_THRESHOLD;
        private double costPerThousandTokens = 0.002;

        /**
         * Initial settings for the cache store.
         */
        public CacheSettings toSettings() {
            return new CacheSettings(enabled, maxEntries, maxAgeDays, matchThreshold);
        }
    }

    @Data
    public static class MaintenanceConfig {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
    }

    @Data
    public static class SnapshotConfig {
        private boolean enabled = false;
        private String key = "cache:snapshot:default";
        private boolean saveOnMaintenance = true;
        private boolean restoreOnStartup = true;
    }
}
