package com.pm.logorganizer.partition;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class HashedApiKeyCacheTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void testHash_knownValue() {
        HashedApiKeyCache cache = new HashedApiKeyCache();

        assertEquals(ABC_SHA256, cache.hash("abc"));
    }

    @Test
    void testHash_absentIdentifier_returnsUndefinedSentinel() {
        HashedApiKeyCache cache = new HashedApiKeyCache();

        assertEquals("undefined", cache.hash(null));
        assertEquals("undefined", cache.hash(""));
        assertEquals(0, cache.size());
        assertEquals(0, cache.getMisses());
    }

    @Test
    void testHash_secondCallIsServedFromCache() {
        HashedApiKeyCache cache = new HashedApiKeyCache();

        String first = cache.hash("api-key-1");
        String second = cache.hash("api-key-1");

        assertEquals(first, second);
        assertEquals(1, cache.getMisses());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.size());
    }

    @Test
    void testHash_distinctKeysGetDistinctHashes() {
        HashedApiKeyCache cache = new HashedApiKeyCache();

        assertNotEquals(cache.hash("api-key-1"), cache.hash("api-key-2"));
        assertEquals(2, cache.size());
    }

    @Test
    void testHash_concurrentCallersAgree() throws Exception {
        // Setup
        HashedApiKeyCache cache = new HashedApiKeyCache();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < threads * 4; i++) {
            tasks.add(() -> {
                start.await();
                return cache.hash("abc");
            });
        }

        // Act
        List<Future<String>> futures = new ArrayList<>();
        try {
            for (Callable<String> task : tasks) {
                futures.add(executor.submit(task));
            }
            start.countDown();

            Set<String> results = futures.stream().map(f -> {
                try {
                    return f.get();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }).collect(Collectors.toSet());

            // Assert
            assertEquals(Set.of(ABC_SHA256), results);
            assertEquals(1, cache.size());
            assertEquals(tasks.size(), cache.getHits() + cache.getMisses());
        } finally {
            executor.shutdownNow();
        }
    }
}
