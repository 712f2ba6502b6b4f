package com.reprise.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-based snapshot repository with compression.
 * Stores one GZIP-compressed JSON document per key.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "reprise.snapshot", name = "enabled", havingValue = "true")
public class RedisSnapshotRepository {

    private final RedisTemplate<String, byte[]> redisTemplate;

    public RedisSnapshotRepository(RedisTemplate<String, byte[]> snapshotRedisTemplate) {
        this.redisTemplate = snapshotRedisTemplate;
    }

    /**
     * Store a snapshot document.
     *
     * @param key  Redis key
     * @param json serialized snapshot
     * @return true if stored
     */
    public boolean save(String key, byte[] json) {
        try {
            byte[] compressed = compress(json);
            redisTemplate.opsForValue().set(key, compressed);

            log.debug("Stored snapshot in Redis: key={}, size={}KB", key, compressed.length / 1024);
            return true;

        } catch (Exception e) {
            log.error("Error storing snapshot to Redis: key={}", key, e);
            return false;
        }
    }

    /**
     * Load a snapshot document.
     *
     * @param key Redis key
     * @return serialized snapshot if present and readable
     */
    public Optional<byte[]> load(String key) {
        try {
            byte[] compressed = redisTemplate.opsForValue().get(key);
            if (compressed == null) {
                log.debug("No snapshot in Redis: {}", key);
                return Optional.empty();
            }
            return Optional.of(decompress(compressed));

        } catch (Exception e) {
            log.error("Error loading snapshot from Redis: key={}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Delete a snapshot.
     *
     * @param key Redis key
     */
    public void delete(String key) {
        try {
            redisTemplate.delete(key);
            log.debug("Deleted snapshot from Redis: {}", key);
        } catch (Exception e) {
            log.error("Error deleting snapshot from Redis: key={}", key, e);
        }
    }

    static byte[] compress(byte[] json) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {

            gzipOut.write(json);
            gzipOut.finish();

            return baos.toByteArray();
        }
    }

    static byte[] decompress(byte[] compressed) throws IOException {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipIn = new GZIPInputStream(bais);
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            byte[] buffer = new byte[1024];
            int len;
            while ((len = gzipIn.read(buffer)) > 0) {
                baos.write(buffer, 0, len);
            }

            return baos.toByteArray();
        }
    }
}
