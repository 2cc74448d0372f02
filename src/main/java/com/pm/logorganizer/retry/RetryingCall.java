package com.pm.logorganizer.retry;

import com.pm.logorganizer.config.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs a blocking call, re-attempting on failure as the call site's {@link RetryPolicy} allows.
 */
public class RetryingCall {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryingCall.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final String callSite;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryingCall(String callSite, RetryPolicy policy) {
        this(callSite, policy, Thread::sleep, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryingCall(String callSite, RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.callSite = callSite;
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * @throws TooManyRetriesException once the attempt limit is used up, carrying the last failure
     */
    public <T> T call(Attempt<T> attempt) throws TooManyRetriesException {
        int limit = policy.attemptLimit();
        int attemptNum = 0;

        while (true) {
            attemptNum++;
            try {
                return attempt.run();
            } catch (Exception e) {
                if (attemptNum >= limit) {
                    LOGGER.error("retry count exceeded for {}, attempts={}", callSite, attemptNum);
                    throw new TooManyRetriesException(callSite, attemptNum, e);
                }

                long delay = policy.nextDelayMs(random.getAsDouble());
                LOGGER.info("Retrying {} {}, date time: {}, backing off {}ms, error: {}", callSite, attemptNum, Instant.now(), delay, e.getMessage());
                if (delay > 0) {
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new TooManyRetriesException(callSite, attemptNum, e);
                    }
                }
            }
        }
    }

    public void run(Attempt<?> attempt) throws TooManyRetriesException {
        call(attempt);
    }

    public String getCallSite() {
        return callSite;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
