/**
 * Blocking request core.
 *
 * <p>{@code AuthenticatedTransport} performs exactly one HTTP exchange per call. Repetition is the
 * retrier's job: {@code ExponentialRetrier} wraps an operation, sleeps per {@code BackoffPolicy}
 * between attempts and stops early when the shared {@code CancellationToken} fires.
 */
package io.polarion.http;
