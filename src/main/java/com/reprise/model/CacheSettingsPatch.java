package com.reprise.model;

import com.reprise.service.InvalidSettingsException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial settings update. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSettingsPatch {

    private Boolean enabled;
    private Integer maxEntries;
    private Integer maxAgeDays;
    private Double matchThreshold;

    /**
     * Validate every supplied field, then apply all of them.
     *
     * @param base settings to start from (not modified)
     * @return merged settings
     * @throws InvalidSettingsException if any supplied field is out of range
     */
    public CacheSettings applyTo(CacheSettings base) {
        List<String> problems = new ArrayList<>();
        if (maxEntries != null && !CacheSettings.isValidMaxEntries(maxEntries)) {
            problems.add("maxEntries must be at least 1, was " + maxEntries);
        }
        if (maxAgeDays != null && !CacheSettings.isValidMaxAgeDays(maxAgeDays)) {
            problems.add("maxAgeDays must not be negative, was " + maxAgeDays);
        }
        if (matchThreshold != null && !CacheSettings.isValidMatchThreshold(matchThreshold)) {
            problems.add("matchThreshold must be within [0, 1], was " + matchThreshold);
        }
        if (!problems.isEmpty()) {
            throw new InvalidSettingsException(String.join("; ", problems));
        }

        CacheSettings merged = base.copy();
        if (enabled != null) {
            merged.setEnabled(enabled);
        }
        if (maxEntries != null) {
            merged.setMaxEntries(maxEntries);
        }
        if (maxAgeDays != null) {
            merged.setMaxAgeDays(maxAgeDays);
        }
        if (matchThreshold != null) {
            merged.setMatchThreshold(matchThreshold);
        }
        return merged;
    }
}
