package io.polarion.http;

import io.polarion.error.CancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancel signal with an optional deadline, shared by one logical call. Cancelling wakes a waiting
 * retrier immediately; an expired deadline counts as cancelled. It never interrupts an HTTP
 * exchange that is already in flight.
 */
public final class CancellationToken {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CountDownLatch signal = new CountDownLatch(1);
    private final long deadlineNanos;
    private volatile String reason;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken create() {
        return new CancellationToken(NO_DEADLINE);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        long now = System.nanoTime();
        long nanos = saturatedNanos(timeout);
        long deadline = nanos >= NO_DEADLINE - now ? NO_DEADLINE - 1 : now + nanos;
        return new CancellationToken(deadline);
    }

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason == null || reason.isBlank() ? "cancelled" : reason;
        }
        signal.countDown();
    }

    public boolean isCancelled() {
        return signal.getCount() == 0 || deadlineExpired();
    }

    public void throwIfCancelled() {
        if (signal.getCount() == 0) {
            throw new CancelledException(reason == null ? "cancelled" : reason);
        }
        if (deadlineExpired()) {
            throw new CancelledException("deadline exceeded");
        }
    }

    /**
     * Blocks for {@code wait}, returning early when the token is cancelled or its deadline passes.
     *
     * @return true if the wait ended because of cancellation
     */
    public boolean await(Duration wait) throws InterruptedException {
        long nanos = saturatedNanos(wait);
        if (deadlineNanos != NO_DEADLINE) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0L) {
                return true;
            }
            if (remaining < nanos) {
                boolean fired = signal.await(remaining, TimeUnit.NANOSECONDS);
                return fired || deadlineExpired();
            }
        }
        return signal.await(nanos, TimeUnit.NANOSECONDS);
    }

    private boolean deadlineExpired() {
        return deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0L;
    }

    private static long saturatedNanos(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0L;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
