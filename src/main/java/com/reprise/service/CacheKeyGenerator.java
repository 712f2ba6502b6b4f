package com.reprise.service;

import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import org.apache.commons.codec.digest.MurmurHash3;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Derives deterministic cache keys from request parameters.
 *
 * Normalization:
 * 1. Trim and lower-case prompt and context independently
 * 2. Hash each with 64-bit MurmurHash3 (base-36, unsigned)
 * 3. Keep the model verbatim
 * 4. Format temperature with exactly two decimal digits (0.7 and 0.70 collide)
 *
 * The hash is stable across processes but not collision-resistant.
 */
@Service
public class CacheKeyGenerator {

    private static final int TEMPERATURE_PRECISION = 2;

    /**
     * Derive the key for a request. Null prompt or context hash as the empty string.
     */
    public CacheKey deriveKey(String prompt, String context, String model, double temperature) {
        return new CacheKey(
                hashText(prompt),
                hashText(context),
                model == null ? "" : model,
                formatTemperature(temperature));
    }

    /**
     * Rebuild the key of a stored entry. Stored hashes are reused when present;
     * otherwise they are recomputed from the prompt, with an empty context.
     */
    public CacheKey keyOf(CacheEntry entry) {
        String promptHash = isBlank(entry.getPromptHash()) ? hashText(entry.getPrompt()) : entry.getPromptHash();
        String contextHash = isBlank(entry.getContextHash()) ? hashText("") : entry.getContextHash();
        return new CacheKey(
                promptHash,
                contextHash,
                entry.getModel() == null ? "" : entry.getModel(),
                formatTemperature(entry.getTemperature()));
    }

    /**
     * Hash normalized text.
     *
     * @param text raw text, may be null
     * @return unsigned base-36 hash
     */
    public String hashText(String text) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        long hash = MurmurHash3.hash128x64(normalized.getBytes(StandardCharsets.UTF_8))[0];
        return Long.toUnsignedString(hash, 36);
    }

    /**
     * Round half-up to two digits.
     */
    String formatTemperature(double temperature) {
        if (!Double.isFinite(temperature)) {
            return String.valueOf(temperature).toLowerCase(Locale.ROOT);
        }
        return BigDecimal.valueOf(temperature)
                .setScale(TEMPERATURE_PRECISION, RoundingMode.HALF_UP)
                .toPlainString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
