package io.polarion.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class BackoffPolicy {
    private final long minWaitNanos;
    private final long maxWaitNanos;

    public BackoffPolicy(Duration minWait, Duration maxWait) {
        if (minWait == null || maxWait == null) {
            throw new IllegalArgumentException("minWait and maxWait are required");
        }
        if (minWait.isNegative()) {
            throw new IllegalArgumentException("minWait must be non-negative, got " + minWait);
        }
        if (maxWait.compareTo(minWait) < 0) {
            throw new IllegalArgumentException("maxWait (" + maxWait + ") must be >= minWait (" + minWait + ")");
        }
        this.minWaitNanos = minWait.toNanos();
        this.maxWaitNanos = maxWait.toNanos();
    }

    public Duration waitFor(int attempt) {
        long base = baseNanos(attempt);
        long jitterRange = base / 2L;
        long jitter = jitterRange <= 0L ? 0L : ThreadLocalRandom.current().nextLong(jitterRange);
        return Duration.ofNanos(base - base / 4L).plusNanos(jitter);
    }

    long baseNanos(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        if (minWaitNanos == 0L) {
            return 0L;
        }
        if (attempt >= 63 || minWaitNanos > (maxWaitNanos >> attempt)) {
            return maxWaitNanos;
        }
        return Math.min(minWaitNanos << attempt, maxWaitNanos);
    }

    public Duration minWait() {
        return Duration.ofNanos(minWaitNanos);
    }

    public Duration maxWait() {
        return Duration.ofNanos(maxWaitNanos);
    }
}
