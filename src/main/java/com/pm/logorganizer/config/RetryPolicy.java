package com.pm.logorganizer.config;

/**
 * Retry settings for one call site. Every numeric setting is optional (null):
 * no delay means retry immediately, no min/max delay means no clamping,
 * and no max attempts means a single attempt.
 */
public class RetryPolicy {
    public static final RetryPolicy SINGLE_ATTEMPT = new RetryPolicy(null, null, null, null, false);

    private final Long delayMs;
    private final Long minDelayMs;
    private final Long maxDelayMs;
    private final Integer maxAttempts;
    private final boolean jitter;

    public RetryPolicy(Long delayMs, Long minDelayMs, Long maxDelayMs, Integer maxAttempts, boolean jitter) {
        this.delayMs = delayMs;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
    }

    public Long getDelayMs() {
        return delayMs;
    }

    public Long getMinDelayMs() {
        return minDelayMs;
    }

    public Long getMaxDelayMs() {
        return maxDelayMs;
    }

    public Integer getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isJitter() {
        return jitter;
    }

    /** Number of attempts allowed, at least one. */
    public int attemptLimit() {
        return maxAttempts == null ? 1 : maxAttempts;
    }

    /**
     * Delay before the next attempt.
     *
     * @param random uniform sample in [0, 1), only used when jitter is on
     */
    public long nextDelayMs(double random) {
        long delay = delayMs == null ? 0 : delayMs;
        if (jitter) {
            delay = (long) (random * delay);
        }
        if (minDelayMs != null) {
            delay = Math.max(delay, minDelayMs);
        }
        if (maxDelayMs != null) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy{delay=%s, minDelay=%s, maxDelay=%s, maxAttempts=%s, jitter=%s}",
            delayMs, minDelayMs, maxDelayMs, maxAttempts, jitter);
    }
}
