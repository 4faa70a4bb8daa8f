package io.polarion.http;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class BackoffPolicyTest {

    @Test
    void baseDoublesPerAttemptAndClampsAtMaxWait() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(8));

        Assertions.assertEquals(Duration.ofSeconds(1).toNanos(), policy.baseNanos(0));
        Assertions.assertEquals(Duration.ofSeconds(2).toNanos(), policy.baseNanos(1));
        Assertions.assertEquals(Duration.ofSeconds(4).toNanos(), policy.baseNanos(2));
        Assertions.assertEquals(Duration.ofSeconds(8).toNanos(), policy.baseNanos(3));
        Assertions.assertEquals(Duration.ofSeconds(8).toNanos(), policy.baseNanos(10));
        Assertions.assertEquals(Duration.ofSeconds(8).toNanos(), policy.baseNanos(500));
    }

    @Test
    void waitStaysInsideJitterWindow() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(15));
        Duration low = Duration.ofMillis(1_500);
        Duration high = Duration.ofMillis(2_500);
        for (int i = 0; i < 500; i++) {
            Duration wait = policy.waitFor(1);
            Assertions.assertTrue(wait.compareTo(low) >= 0, "too short: " + wait);
            Assertions.assertTrue(wait.compareTo(high) < 0, "too long: " + wait);
        }
    }

    @Test
    void clampedWaitKeepsJitterAroundMaxWait() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(15));
        for (int i = 0; i < 200; i++) {
            Duration wait = policy.waitFor(7);
            Assertions.assertTrue(wait.compareTo(Duration.ofMillis(11_250)) >= 0);
            Assertions.assertTrue(wait.compareTo(Duration.ofMillis(18_750)) < 0);
        }
    }

    @Test
    void zeroWaitsNeverSleep() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ZERO, Duration.ZERO);
        Assertions.assertEquals(Duration.ZERO, policy.waitFor(0));
        Assertions.assertEquals(Duration.ZERO, policy.waitFor(40));
    }

    @Test
    void hugeMaxWaitDoesNotOverflow() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofNanos(Long.MAX_VALUE));
        Assertions.assertEquals(Long.MAX_VALUE, policy.baseNanos(62));
        Duration wait = policy.waitFor(62);
        Assertions.assertFalse(wait.isNegative());
        Assertions.assertTrue(wait.compareTo(Duration.ofNanos(Long.MAX_VALUE - Long.MAX_VALUE / 4L)) >= 0);
    }

    @Test
    void negativeAttemptIsRejected() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(20));
        Assertions.assertThrows(IllegalArgumentException.class, () -> policy.waitFor(-1));
    }

    @Test
    void maxBelowMinIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
    }
}
