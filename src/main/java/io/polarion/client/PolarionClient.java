package io.polarion.client;

import com.fasterxml.jackson.core.type.TypeReference;
import io.polarion.config.PolarionConfig;
import io.polarion.error.PolarionException;
import io.polarion.http.AuthenticatedTransport;
import io.polarion.http.CancellationToken;
import io.polarion.http.ResponseDecoder;
import io.polarion.http.Retrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.Objects;

public final class PolarionClient {
    private static final Logger LOG = LoggerFactory.getLogger(PolarionClient.class);

    private final PolarionConfig config;
    private final AuthenticatedTransport transport;
    private final Retrier retrier;

    PolarionClient(PolarionConfig config, AuthenticatedTransport transport, Retrier retrier) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.retrier = Objects.requireNonNull(retrier, "retrier");
    }

    public static PolarionClient create(PolarionConfig config) {
        Objects.requireNonNull(config, "config");
        HttpClient httpClient = config.httpClient() != null
                ? config.httpClient()
                : HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        AuthenticatedTransport transport = new AuthenticatedTransport(
                httpClient,
                config.token(),
                config.mediaType(),
                config.requestTimeout()
        );
        return new PolarionClient(config, transport, Retrier.forConfig(config.retry()));
    }

    public PolarionConfig config() {
        return config;
    }

    public WorkItemService workItems(String projectId) {
        return new WorkItemService(this, projectId);
    }

    /**
     * Sends {@code body} (serialized as JSON, may be null) to {@code path} relative to the base URL,
     * retrying per the configured policy. The caller owns the returned body.
     */
    public HttpResponse<InputStream> execute(CancellationToken token, String method, String path, Object body) {
        URI uri = config.resolve(path);
        try {
            return retrier.execute(token, () -> transport.execute(method, uri, body));
        } catch (PolarionException e) {
            LOG.debug("{} {} failed: {}", method, uri, e.getMessage(), e);
            throw e;
        }
    }

    public HttpResponse<InputStream> execute(String method, String path, Object body) {
        return execute(CancellationToken.create(), method, path, body);
    }

    public <T> T getEnvelope(CancellationToken token, String path, Class<T> type) {
        return ResponseDecoder.decodeEnvelope(execute(token, "GET", path, null), type);
    }

    public <T> T getEnvelope(CancellationToken token, String path, TypeReference<T> type) {
        return ResponseDecoder.decodeEnvelope(execute(token, "GET", path, null), type);
    }

    public <T> T getEnvelope(String path, Class<T> type) {
        return getEnvelope(CancellationToken.create(), path, type);
    }
}
