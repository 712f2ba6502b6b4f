package com.reprise.service;

import com.reprise.model.CacheEntry;
import com.reprise.model.CacheKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKeyGenerator.
 */
class CacheKeyGeneratorTest {

    private CacheKeyGenerator keyGenerator;

    @BeforeEach
    void setUp() {
        keyGenerator = new CacheKeyGenerator();
    }

    @Test
    void testSameInputsProduceSameKey() {
        CacheKey key1 = keyGenerator.deriveKey("hello", "context", "gpt-4", 0.7);
        CacheKey key2 = keyGenerator.deriveKey("hello", "context", "gpt-4", 0.7);

        assertEquals(key1, key2);
        assertEquals(key1.asString(), key2.asString());
    }

    @Test
    void testPromptAndContextAreNormalized() {
        CacheKey key1 = keyGenerator.deriveKey("  Hello World ", "Some CONTEXT", "gpt-4", 0.7);
        CacheKey key2 = keyGenerator.deriveKey("hello world", "some context  ", "gpt-4", 0.7);

        assertEquals(key1, key2);
    }

    @Test
    void testTemperatureUsesTwoDecimals() {
        CacheKey key1 = keyGenerator.deriveKey("hello", "", "gpt-4", 0.7);
        CacheKey key2 = keyGenerator.deriveKey("hello", "", "gpt-4", 0.70);
        CacheKey key3 = keyGenerator.deriveKey("hello", "", "gpt-4", 0.7000001);

        assertEquals("0.70", key1.temperature());
        assertEquals(key1, key2);
        assertEquals(key1, key3);
        assertEquals("1.00", keyGenerator.deriveKey("hello", "", "gpt-4", 1).temperature());
    }

    @Test
    void testDifferentParametersProduceDifferentKeys() {
        CacheKey base = keyGenerator.deriveKey("hello", "context", "gpt-4", 0.7);

        assertNotEquals(base, keyGenerator.deriveKey("world", "context", "gpt-4", 0.7));
        assertNotEquals(base, keyGenerator.deriveKey("hello", "other", "gpt-4", 0.7));
        assertNotEquals(base, keyGenerator.deriveKey("hello", "context", "gpt-3.5-turbo", 0.7));
        assertNotEquals(base, keyGenerator.deriveKey("hello", "context", "gpt-4", 0.9));
    }

    @Test
    void testModelIsKeptVerbatim() {
        CacheKey lower = keyGenerator.deriveKey("hello", "", "gpt-4", 0.7);
        CacheKey upper = keyGenerator.deriveKey("hello", "", "GPT-4", 0.7);

        assertNotEquals(lower, upper);
        assertEquals("GPT-4", upper.model());
    }

    @Test
    void testNullContextHashesLikeEmptyString() {
        CacheKey withNull = keyGenerator.deriveKey("hello", null, "gpt-4", 0.7);
        CacheKey withEmpty = keyGenerator.deriveKey("hello", "", "gpt-4", 0.7);

        assertEquals(withNull, withEmpty);
        assertFalse(withNull.contextHash().isEmpty());
    }

    @Test
    void testKeyStringJoinsComponentsInOrder() {
        CacheKey key = new CacheKey("p", "c", "gpt-4", "0.70");
        assertEquals("p_c_gpt-4_0.70", key.asString());
    }

    @Test
    void testKeyOfEntryReusesStoredHashes() {
        CacheEntry entry = CacheEntry.builder()
                .promptHash("abc")
                .contextHash("def")
                .prompt("ignored when hashes are present")
                .model("gpt-4")
                .temperature(0.5)
                .build();

        assertEquals("abc_def_gpt-4_0.50", keyGenerator.keyOf(entry).asString());
    }

    @Test
    void testKeyOfEntryRecomputesMissingHashes() {
        CacheEntry entry = CacheEntry.builder()
                .prompt("Hello")
                .model("gpt-4")
                .temperature(0.7)
                .build();

        assertEquals(keyGenerator.deriveKey("hello", "", "gpt-4", 0.7), keyGenerator.keyOf(entry));
    }
}
