package io.polarion.config;

import io.polarion.http.AuthenticatedTransport;
import io.polarion.http.RetryConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;

public final class PolarionConfig {
    public static final String REST_PATH = "/polarion/rest/v1";
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final String DEFAULT_MEDIA_TYPE = AuthenticatedTransport.DEFAULT_MEDIA_TYPE;
    public static final String ENV_URL = "POLARION_URL";
    public static final String ENV_TOKEN = "POLARION_TOKEN";

    private final URI baseUri;
    private final String token;
    private final RetryConfig retry;
    private final Duration requestTimeout;
    private final Duration connectTimeout;
    private final String mediaType;
    private final HttpClient httpClient;

    private PolarionConfig(
            URI baseUri,
            String token,
            RetryConfig retry,
            Duration requestTimeout,
            Duration connectTimeout,
            String mediaType,
            HttpClient httpClient
    ) {
        this.baseUri = baseUri;
        this.token = token;
        this.retry = retry;
        this.requestTimeout = requestTimeout;
        this.connectTimeout = connectTimeout;
        this.mediaType = mediaType;
        this.httpClient = httpClient;
    }

    /**
     * @param baseUrl REST root, e.g. {@code https://polarion.example.com/polarion/rest/v1}
     * @param token   personal access token sent as a bearer credential
     */
    public static PolarionConfig of(String baseUrl, String token) {
        return new PolarionConfig(
                parseBaseUri(baseUrl),
                requireToken(token),
                RetryConfig.defaults(),
                DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_CONNECT_TIMEOUT,
                DEFAULT_MEDIA_TYPE,
                null
        );
    }

    public PolarionConfig withRetry(RetryConfig value) {
        RetryConfig safe = value == null ? RetryConfig.disabled() : value;
        return new PolarionConfig(baseUri, token, safe, requestTimeout, connectTimeout, mediaType, httpClient);
    }

    public PolarionConfig withRequestTimeout(Duration value) {
        return new PolarionConfig(baseUri, token, retry, requirePositive(value, "request timeout"), connectTimeout, mediaType, httpClient);
    }

    public PolarionConfig withConnectTimeout(Duration value) {
        return new PolarionConfig(baseUri, token, retry, requestTimeout, requirePositive(value, "connect timeout"), mediaType, httpClient);
    }

    public PolarionConfig withMediaType(String value) {
        String safe = value == null || value.isBlank() ? DEFAULT_MEDIA_TYPE : value.trim();
        return new PolarionConfig(baseUri, token, retry, requestTimeout, connectTimeout, safe, httpClient);
    }

    /**
     * Uses {@code client} instead of building one; its own connect timeout then applies.
     */
    public PolarionConfig withHttpClient(HttpClient client) {
        return new PolarionConfig(baseUri, token, retry, requestTimeout, connectTimeout, mediaType, client);
    }

    public URI baseUri() {
        return baseUri;
    }

    public String token() {
        return token;
    }

    public RetryConfig retry() {
        return retry;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public String mediaType() {
        return mediaType;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    /**
     * Resolves {@code path} against the base URI. Leading slashes on {@code path} are ignored.
     */
    public URI resolve(String path) {
        String base = baseUri.toString();
        String suffix = path == null ? "" : path;
        while (suffix.startsWith("/")) {
            suffix = suffix.substring(1);
        }
        return URI.create(suffix.isEmpty() ? base : base + "/" + suffix);
    }

    @Override
    public String toString() {
        return "PolarionConfig{baseUri=" + baseUri
                + ", retry=" + retry.maxRetries()
                + ", requestTimeout=" + requestTimeout
                + ", mediaType=" + mediaType + "}";
    }

    static URI parseBaseUri(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("base URL is required");
        }
        String normalized = raw.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        URI uri;
        try {
            uri = new URI(normalized);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid base URL: " + raw, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException("base URL must use http or https: " + raw);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("base URL has no host: " + raw);
        }
        return uri;
    }

    private static String requireToken(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("bearer token is required");
        }
        return raw.trim();
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
