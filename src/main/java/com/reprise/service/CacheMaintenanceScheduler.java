package com.reprise.service;

import com.reprise.config.RepriseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic cache upkeep: expiry sweep, value-scored pruning, optional snapshot.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "reprise.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheMaintenanceScheduler {

    private final ResponseCacheStore cacheStore;
    private final SnapshotService snapshotService;
    private final RepriseProperties properties;

    public CacheMaintenanceScheduler(
            ResponseCacheStore cacheStore,
            SnapshotService snapshotService,
            RepriseProperties properties) {
        this.cacheStore = cacheStore;
        this.snapshotService = snapshotService;
        this.properties = properties;
    }

    @Scheduled(
            fixedDelayString = "${reprise.maintenance.interval:PT1H}",
            initialDelayString = "${reprise.maintenance.interval:PT1H}")
    public void runMaintenance() {
        int expired = cacheStore.cleanExpired();
        int optimized = cacheStore.optimize();

        boolean saved = false;
        if (properties.getSnapshot().isSaveOnMaintenance() && snapshotService.isAvailable()) {
            saved = snapshotService.saveSnapshot();
        }

        log.debug("Cache maintenance done: expired={}, optimized={}, snapshot_saved={}", expired, optimized, saved);
    }
}
