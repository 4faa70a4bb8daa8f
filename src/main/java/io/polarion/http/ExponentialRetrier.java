package io.polarion.http;

import io.polarion.error.CancelledException;
import io.polarion.error.RetryExhaustedException;

import java.time.Duration;
import java.util.Objects;

public final class ExponentialRetrier implements Retrier {
    private final RetryConfig config;
    private final BackoffPolicy backoff;

    public ExponentialRetrier(RetryConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.backoff = config.backoffPolicy();
    }

    public RetryConfig config() {
        return config;
    }

    @Override
    public <T> T execute(CancellationToken token, RetryableCall<T> call) {
        CancellationToken cancel = token == null ? CancellationToken.create() : token;
        RuntimeException lastFailure = null;
        int attempts = 0;
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            cancel.throwIfCancelled();
            attempts++;
            try {
                return call.call();
            } catch (CancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                lastFailure = e;
                if (config.retryIf() != null && !config.retryIf().test(e)) {
                    throw e;
                }
            }
            if (attempt == config.maxRetries()) {
                break;
            }
            sleep(cancel, backoff.waitFor(attempt));
        }
        throw new RetryExhaustedException(attempts, lastFailure);
    }

    private static void sleep(CancellationToken cancel, Duration wait) {
        try {
            if (cancel.await(wait)) {
                cancel.throwIfCancelled();
                throw new CancelledException("cancelled while waiting to retry");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting to retry", e);
        }
    }
}
