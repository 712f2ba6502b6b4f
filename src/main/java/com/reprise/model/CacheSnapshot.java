package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Persistence shape for export/import. A null block means "not provided".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSnapshot {

    /**
     * Entries, most recently accessed first when exported.
     */
    private List<CacheEntry> entries;

    private CacheStats stats;

    private CacheSettings settings;
}
