package io.polarion.http;

public interface Retrier {
    <T> T execute(CancellationToken token, RetryableCall<T> call);

    default <T> T execute(RetryableCall<T> call) {
        return execute(CancellationToken.create(), call);
    }

    static Retrier forConfig(RetryConfig config) {
        if (config == null || config.maxRetries() == 0) {
            return new NoopRetrier();
        }
        return new ExponentialRetrier(config);
    }
}
