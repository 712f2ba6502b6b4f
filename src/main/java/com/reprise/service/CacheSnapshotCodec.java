package com.reprise.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheSettings;
import com.reprise.model.CacheSnapshot;
import com.reprise.model.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts cache snapshots to and from JSON.
 *
 * Decoding is lenient below the top level: an entry that cannot be bound is dropped,
 * and an unreadable stats or settings block is treated as absent.
 */
@Slf4j
@Component
public class CacheSnapshotCodec {

    private final ObjectMapper objectMapper;

    public CacheSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(CacheSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Failed to serialize cache snapshot", e);
        }
    }

    /**
     * @throws SnapshotFormatException if the bytes are not a JSON object
     */
    public CacheSnapshot decode(byte[] json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SnapshotFormatException("Snapshot is not valid JSON", e);
        }
        return decode(root);
    }

    /**
     * @throws SnapshotFormatException if the node is not a JSON object
     */
    public CacheSnapshot decode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SnapshotFormatException("Snapshot must be a JSON object");
        }

        return CacheSnapshot.builder()
                .entries(decodeEntries(root.get("entries")))
                .stats(decodeBlock(root.get("stats"), CacheStats.class))
                .settings(decodeBlock(root.get("settings"), CacheSettings.class))
                .build();
    }

    private List<CacheEntry> decodeEntries(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            log.warn("Snapshot entries is not an array, ignoring it");
            return null;
        }

        List<CacheEntry> entries = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            try {
                entries.add(objectMapper.treeToValue(element, CacheEntry.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping unreadable snapshot entry: {}", e.getMessage());
            }
        }
        return entries;
    }

    private <T> T decodeBlock(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable snapshot {} block: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
