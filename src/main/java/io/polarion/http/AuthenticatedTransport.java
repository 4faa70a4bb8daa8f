package io.polarion.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.polarion.error.ApiException;
import io.polarion.error.CancelledException;
import io.polarion.error.ErrorDetail;
import io.polarion.error.TransportException;
import io.polarion.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class AuthenticatedTransport implements Transport {
    public static final String DEFAULT_MEDIA_TYPE = "application/json";

    private final HttpClient httpClient;
    private final String bearerToken;
    private final String mediaType;
    private final Duration requestTimeout;

    public AuthenticatedTransport(HttpClient httpClient, String bearerToken) {
        this(httpClient, bearerToken, DEFAULT_MEDIA_TYPE, null);
    }

    public AuthenticatedTransport(HttpClient httpClient, String bearerToken, String mediaType, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IllegalArgumentException("bearerToken cannot be empty");
        }
        this.bearerToken = bearerToken.trim();
        this.mediaType = mediaType == null || mediaType.isBlank() ? DEFAULT_MEDIA_TYPE : mediaType.trim();
        this.requestTimeout = requestTimeout;
    }

    public HttpResponse<InputStream> execute(String method, URI uri, Object body) {
        return execute(method, uri, body, null);
    }

    /**
     * Builds and sends a request; {@code accept} overrides the negotiated media type for endpoints
     * that do not answer in JSON:API form.
     */
    public HttpResponse<InputStream> execute(String method, URI uri, Object body, String accept) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).method(method, publisher);
        if (accept != null && !accept.isBlank()) {
            builder.header("Accept", accept);
        }
        return send(builder.build());
    }

    @Override
    public HttpResponse<InputStream> send(HttpRequest original) {
        HttpRequest request = prepare(original);
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new TransportException("http request failed: " + request.method() + " " + request.uri() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted during " + request.method() + " " + request.uri(), e);
        }
        if (response.statusCode() >= 400) {
            throw toApiException(response);
        }
        return response;
    }

    HttpRequest prepare(HttpRequest original) {
        HttpRequest.Builder copy = HttpRequest.newBuilder(original, (name, value) -> !"authorization".equalsIgnoreCase(name));
        copy.setHeader("Authorization", "Bearer " + bearerToken);
        if (original.headers().firstValue("Content-Type").isEmpty()) {
            copy.setHeader("Content-Type", mediaType);
        }
        if (original.headers().firstValue("Accept").isEmpty()) {
            copy.setHeader("Accept", mediaType);
        }
        if (original.timeout().isEmpty() && requestTimeout != null) {
            copy.timeout(requestTimeout);
        }
        return copy.build();
    }

    static ApiException toApiException(HttpResponse<InputStream> response) {
        int status = response.statusCode();
        String method = response.request().method();
        URI uri = response.request().uri();
        String rawBody;
        try (InputStream in = response.body()) {
            rawBody = in == null ? "" : new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new ApiException(status, "failed to read error response", List.of(), "", method, uri);
        }
        List<ErrorDetail> details = parseErrorDetails(rawBody);
        if (details.isEmpty()) {
            return new ApiException(status, rawBody, List.of(), rawBody, method, uri);
        }
        return new ApiException(status, statusLine(status), details, rawBody, method, uri);
    }

    static List<ErrorDetail> parseErrorDetails(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(rawBody);
        } catch (IOException e) {
            return List.of();
        }
        JsonNode errors = root == null ? null : root.path("errors");
        if (errors == null || !errors.isArray()) {
            return List.of();
        }
        List<ErrorDetail> out = new ArrayList<>();
        for (JsonNode item : errors) {
            if (!item.isObject()) {
                continue;
            }
            String pointer = item.path("pointer").asText("");
            if (pointer.isEmpty()) {
                pointer = item.path("source").path("pointer").asText("");
            }
            out.add(new ErrorDetail(
                    item.path("status").asText(""),
                    item.path("title").asText(""),
                    item.path("detail").asText(""),
                    pointer
            ));
        }
        return out;
    }

    private static String statusLine(int status) {
        String reason = switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 409 -> "Conflict";
            case 422 -> "Unprocessable Entity";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "";
        };
        return reason.isEmpty() ? Integer.toString(status) : status + " " + reason;
    }
}
