package io.polarion.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import io.polarion.error.DecodeException;
import io.polarion.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;

public final class ResponseDecoder {
    private ResponseDecoder() {
    }

    public static <T> T decodeEnvelope(HttpResponse<InputStream> response, Class<T> type) {
        return decodeEnvelope(response, Jsons.mapper().constructType(type));
    }

    public static <T> T decodeEnvelope(HttpResponse<InputStream> response, TypeReference<T> type) {
        return decodeEnvelope(response, Jsons.mapper().constructType(type));
    }

    public static <T> T decodeRaw(HttpResponse<InputStream> response, Class<T> type) {
        return decodeRaw(response, Jsons.mapper().constructType(type));
    }

    public static <T> T decodeRaw(HttpResponse<InputStream> response, TypeReference<T> type) {
        return decodeRaw(response, Jsons.mapper().constructType(type));
    }

    public static void discard(HttpResponse<InputStream> response) {
        try (InputStream ignored = response.body()) {
            // closing releases the connection
        } catch (IOException e) {
            throw new DecodeException("failed to release response body", e);
        }
    }

    private static <T> T decodeEnvelope(HttpResponse<InputStream> response, JavaType type) {
        JsonNode root = readTree(response);
        if (root == null || !root.isObject()) {
            throw new DecodeException("failed to decode response wrapper: expected a JSON object");
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            throw new DecodeException("failed to decode response wrapper: missing data");
        }
        return convert(data, type);
    }

    private static <T> T decodeRaw(HttpResponse<InputStream> response, JavaType type) {
        JsonNode root = readTree(response);
        if (root == null || root.isMissingNode()) {
            throw new DecodeException("failed to decode response: empty body");
        }
        return convert(root, type);
    }

    private static JsonNode readTree(HttpResponse<InputStream> response) {
        try (InputStream in = response.body()) {
            if (in == null) {
                return null;
            }
            return Jsons.mapper().readTree(in);
        } catch (IOException e) {
            throw new DecodeException("failed to decode response: " + e.getMessage(), e);
        }
    }

    private static <T> T convert(JsonNode node, JavaType type) {
        try {
            return Jsons.mapper().treeToValue(node, type);
        } catch (IOException | IllegalArgumentException e) {
            throw new DecodeException("failed to decode response data: " + e.getMessage(), e);
        }
    }
}
