package io.polarion.http;

import io.polarion.error.ApiException;
import io.polarion.error.ApiErrors;
import io.polarion.error.CancelledException;
import io.polarion.error.RetryExhaustedException;
import io.polarion.error.TransportException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class RetrierTest {

    private static RetryConfig fast(int maxRetries) {
        return new RetryConfig(maxRetries, Duration.ofMillis(1), Duration.ofMillis(5), ApiErrors::isRetryable);
    }

    private static ApiException apiError(int status) {
        return new ApiException(status, "boom", List.of(), "boom", "GET", URI.create("http://localhost/x"));
    }

    @Test
    void succeedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = new ExponentialRetrier(fast(3)).execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransportException("connection reset", new IOException("reset"));
            }
            return "ok";
        });

        Assertions.assertEquals("ok", result);
        Assertions.assertEquals(3, calls.get());
    }

    @Test
    void nonRetryableFailurePropagatesUnchanged() {
        AtomicInteger calls = new AtomicInteger();
        ApiException notFound = apiError(404);

        ApiException thrown = Assertions.assertThrows(ApiException.class,
                () -> new ExponentialRetrier(fast(5)).execute(() -> {
                    calls.incrementAndGet();
                    throw notFound;
                }));

        Assertions.assertSame(notFound, thrown);
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void exhaustionWrapsTheLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        ApiException[] last = new ApiException[1];

        RetryExhaustedException thrown = Assertions.assertThrows(RetryExhaustedException.class,
                () -> new ExponentialRetrier(fast(2)).execute(() -> {
                    calls.incrementAndGet();
                    last[0] = apiError(503);
                    throw last[0];
                }));

        Assertions.assertEquals(3, calls.get());
        Assertions.assertEquals(3, thrown.attempts());
        Assertions.assertSame(last[0], thrown.getCause());
        Assertions.assertTrue(thrown.getMessage().startsWith("max retries exceeded after 3 attempt(s)"));
    }

    @Test
    void missingPredicateRetriesEveryFailure() {
        AtomicInteger calls = new AtomicInteger();
        RetryConfig config = new RetryConfig(2, Duration.ofMillis(1), Duration.ofMillis(2), null);

        Assertions.assertThrows(RetryExhaustedException.class,
                () -> new ExponentialRetrier(config).execute(() -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("always");
                }));
        Assertions.assertEquals(3, calls.get());
    }

    @Test
    void cancelledTokenSkipsTheFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        Assertions.assertThrows(CancelledException.class,
                () -> new ExponentialRetrier(fast(3)).execute(token, calls::incrementAndGet));
        Assertions.assertEquals(0, calls.get());
    }

    @Test
    void cancellationWakesAWaitingRetrier() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        RetryConfig slow = new RetryConfig(3, Duration.ofSeconds(20), Duration.ofSeconds(20), null);
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(100L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel("shutdown");
        });

        long started = System.nanoTime();
        canceller.start();
        CancelledException thrown = Assertions.assertThrows(CancelledException.class,
                () -> new ExponentialRetrier(slow).execute(token, () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("fail");
                }));
        canceller.join();

        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals("shutdown", thrown.getMessage());
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void deadlineBoundsTheWait() {
        AtomicInteger calls = new AtomicInteger();
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(100));
        RetryConfig slow = new RetryConfig(3, Duration.ofSeconds(20), Duration.ofSeconds(20), null);

        long started = System.nanoTime();
        CancelledException thrown = Assertions.assertThrows(CancelledException.class,
                () -> new ExponentialRetrier(slow).execute(token, () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("fail");
                }));

        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals("deadline exceeded", thrown.getMessage());
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
    }

    @Test
    void interruptDuringWaitCountsAsCancellation() {
        RetryConfig slow = new RetryConfig(3, Duration.ofSeconds(20), Duration.ofSeconds(20), null);
        Thread.currentThread().interrupt();
        try {
            Assertions.assertThrows(CancelledException.class,
                    () -> new ExponentialRetrier(slow).execute(() -> {
                        throw new IllegalStateException("fail");
                    }));
            Assertions.assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void zeroRetriesInvokesExactlyOnce() {
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException thrown = Assertions.assertThrows(RetryExhaustedException.class,
                () -> new ExponentialRetrier(fast(0)).execute(() -> {
                    calls.incrementAndGet();
                    throw apiError(503);
                }));

        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals(1, thrown.attempts());
        Assertions.assertEquals("done", new ExponentialRetrier(fast(0)).execute(() -> "done"));
    }

    @Test
    void zeroRetriesSelectsTheNoopRetrier() {
        Assertions.assertInstanceOf(NoopRetrier.class, Retrier.forConfig(RetryConfig.disabled()));
        Assertions.assertInstanceOf(NoopRetrier.class, Retrier.forConfig(null));
        Assertions.assertInstanceOf(ExponentialRetrier.class, Retrier.forConfig(RetryConfig.defaults()));
    }

    @Test
    void noopRetrierRunsOnceAndPropagatesUnchanged() {
        AtomicInteger calls = new AtomicInteger();
        ApiException unavailable = apiError(503);

        ApiException thrown = Assertions.assertThrows(ApiException.class,
                () -> new NoopRetrier().execute(() -> {
                    calls.incrementAndGet();
                    throw unavailable;
                }));

        Assertions.assertSame(unavailable, thrown);
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void retryConfigRejectsInvalidValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> RetryConfig.defaults().withMaxRetries(-1));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RetryConfig.defaults().withWaits(Duration.ofSeconds(10), Duration.ofSeconds(1)));
        RetryConfig defaults = RetryConfig.defaults();
        Assertions.assertEquals(1, defaults.maxRetries());
        Assertions.assertEquals(Duration.ofSeconds(5), defaults.minWait());
        Assertions.assertEquals(Duration.ofSeconds(15), defaults.maxWait());
    }
}
