package io.polarion.error;

public final class RetryExhaustedException extends PolarionException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("max retries exceeded after " + attempts + " attempt(s): " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
