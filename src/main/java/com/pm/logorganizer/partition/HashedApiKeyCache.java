package com.pm.logorganizer.partition;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes the SHA-256 (hex) hash of API-key identifiers for the life of the process.
 * Concurrent callers may compute the same hash twice; the result is identical either way.
 */
public class HashedApiKeyCache {
    public static final String UNDEFINED = "undefined";

    private final Map<String, String> hashes = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * @param apiKeyId raw identifier, may be null or empty
     * @return hex-encoded SHA-256 of the identifier, or {@value #UNDEFINED} when it is absent
     */
    public String hash(String apiKeyId) {
        if (apiKeyId == null || apiKeyId.isEmpty()) {
            return UNDEFINED;
        }

        String hashed = hashes.get(apiKeyId);
        if (hashed != null) {
            hits.incrementAndGet();
            return hashed;
        }

        misses.incrementAndGet();
        hashed = Hashing.sha256().hashString(apiKeyId, StandardCharsets.UTF_8).toString();
        hashes.put(apiKeyId, hashed);
        return hashed;
    }

    public int size() {
        return hashes.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
