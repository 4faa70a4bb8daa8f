package io.polarion.http;

public final class NoopRetrier implements Retrier {
    @Override
    public <T> T execute(CancellationToken token, RetryableCall<T> call) {
        if (token != null) {
            token.throwIfCancelled();
        }
        return call.call();
    }
}
