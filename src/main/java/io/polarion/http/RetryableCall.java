package io.polarion.http;

@FunctionalInterface
public interface RetryableCall<T> {
    T call();
}
