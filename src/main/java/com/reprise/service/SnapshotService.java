package com.reprise.service;

import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheSnapshot;
import com.reprise.repository.RedisSnapshotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Saves and restores cache snapshots through Redis.
 * Without a repository (snapshots disabled) every operation is a no-op returning false.
 */
@Slf4j
@Service
public class SnapshotService {

    private final ResponseCacheStore cacheStore;
    private final CacheSnapshotCodec codec;
    private final Optional<RedisSnapshotRepository> repository;
    private final RepriseProperties properties;

    public SnapshotService(
            ResponseCacheStore cacheStore,
            CacheSnapshotCodec codec,
            Optional<RedisSnapshotRepository> repository,
            RepriseProperties properties) {
        this.cacheStore = cacheStore;
        this.codec = codec;
        this.repository = repository;
        this.properties = properties;
    }

    public boolean isAvailable() {
        return repository.isPresent();
    }

    /**
     * Persist the current cache contents.
     *
     * @return true if the snapshot was stored
     */
    public boolean saveSnapshot() {
        if (repository.isEmpty()) {
            return false;
        }

        CacheSnapshot snapshot = cacheStore.exportCache();
        boolean saved = repository.get().save(snapshotKey(), codec.encode(snapshot));
        if (saved) {
            log.info("Saved cache snapshot: {} entries", snapshot.getEntries().size());
        }
        return saved;
    }

    /**
     * Replace cache contents with the last stored snapshot.
     *
     * @return true if a snapshot was found and imported
     */
    public boolean restoreSnapshot() {
        if (repository.isEmpty()) {
            return false;
        }

        Optional<byte[]> stored = repository.get().load(snapshotKey());
        if (stored.isEmpty()) {
            log.info("No cache snapshot to restore");
            return false;
        }

        try {
            cacheStore.importCache(codec.decode(stored.get()));
            log.info("Restored cache snapshot: {} entries", cacheStore.getStats().getTotalEntries());
            return true;
        } catch (SnapshotFormatException e) {
            log.warn("Stored cache snapshot is unreadable, starting empty", e);
            return false;
        }
    }

    /**
     * Drop the stored snapshot. The live cache is not touched.
     *
     * @return true if a repository was available
     */
    public boolean deleteSnapshot() {
        if (repository.isEmpty()) {
            return false;
        }

        repository.get().delete(snapshotKey());
        log.info("Deleted cache snapshot: key={}", snapshotKey());
        return true;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreOnStartup() {
        if (isAvailable() && properties.getSnapshot().isRestoreOnStartup()) {
            restoreSnapshot();
        }
    }

    private String snapshotKey() {
        return properties.getSnapshot().getKey();
    }
}
