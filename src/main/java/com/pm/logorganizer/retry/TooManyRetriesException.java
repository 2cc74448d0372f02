package com.pm.logorganizer.retry;

public class TooManyRetriesException extends Exception {
    private final int attempts;

    public TooManyRetriesException(String callSite, int attempts, Throwable lastFailure) {
        super("Too many retries for " + callSite + ": " + attempts + " attempts, last error: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
