package com.reprise.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for RedisSnapshotRepository.
 */
@ExtendWith(MockitoExtension.class)
class RedisSnapshotRepositoryTest {

    private static final String KEY = "cache:snapshot:test";

    @Mock
    private RedisTemplate<String, byte[]> redisTemplate;

    @Mock
    private ValueOperations<String, byte[]> valueOperations;

    private RedisSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        repository = new RedisSnapshotRepository(redisTemplate);
    }

    @Test
    void testSaveStoresCompressedDocument() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        byte[] json = "{\"entries\":[]}".getBytes(StandardCharsets.UTF_8);

        assertTrue(repository.save(KEY, json));

        ArgumentCaptor<byte[]> stored = ArgumentCaptor.forClass(byte[].class);
        verify(valueOperations).set(eq(KEY), stored.capture());
        assertArrayEquals(json, RedisSnapshotRepository.decompress(stored.getValue()));
    }

    @Test
    void testLoadDecompresses() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        byte[] json = "{\"stats\":{}}".getBytes(StandardCharsets.UTF_8);
        when(valueOperations.get(KEY)).thenReturn(RedisSnapshotRepository.compress(json));

        Optional<byte[]> loaded = repository.load(KEY);

        assertTrue(loaded.isPresent());
        assertArrayEquals(json, loaded.get());
    }

    @Test
    void testLoadMissingKey() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn(null);

        assertTrue(repository.load(KEY).isEmpty());
    }

    @Test
    void testLoadCorruptDataIsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn("not gzip".getBytes(StandardCharsets.UTF_8));

        assertTrue(repository.load(KEY).isEmpty());
    }

    @Test
    void testSaveFailureIsReported() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(eq(KEY), any(byte[].class));

        assertFalse(repository.save(KEY, new byte[]{'{', '}'}));
    }

    @Test
    void testDelete() {
        repository.delete(KEY);

        verify(redisTemplate).delete(KEY);
    }
}
