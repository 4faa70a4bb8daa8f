package io.polarion.error;

import java.net.URI;
import java.util.List;

public final class ApiException extends PolarionException {
    private final int statusCode;
    private final String apiMessage;
    private final List<ErrorDetail> details;
    private final String rawBody;
    private final String method;
    private final URI uri;

    public ApiException(int statusCode, String apiMessage, List<ErrorDetail> details, String rawBody, String method, URI uri) {
        super(format(statusCode, apiMessage, details, method, uri));
        this.statusCode = statusCode;
        this.apiMessage = apiMessage == null ? "" : apiMessage;
        this.details = details == null ? List.of() : List.copyOf(details);
        this.rawBody = rawBody == null ? "" : rawBody;
        this.method = method == null ? "" : method;
        this.uri = uri;
    }

    public int statusCode() {
        return statusCode;
    }

    public String apiMessage() {
        return apiMessage;
    }

    public List<ErrorDetail> details() {
        return details;
    }

    public String rawBody() {
        return rawBody;
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public String detailedMessage() {
        if (!rawBody.isEmpty() && rawBody.length() < 1000) {
            return getMessage() + "\nRaw response: " + rawBody;
        }
        return getMessage();
    }

    private static String format(int statusCode, String message, List<ErrorDetail> details, String method, URI uri) {
        StringBuilder sb = new StringBuilder()
                .append("polarion api error (status ").append(statusCode).append(") for ")
                .append(method == null ? "" : method).append(' ')
                .append(uri == null ? "" : uri.toString()).append(": ")
                .append(message == null ? "" : message);
        if (details != null && !details.isEmpty()) {
            sb.append(" - ");
            for (int i = 0; i < details.size(); i++) {
                if (i > 0) {
                    sb.append("; ");
                }
                sb.append(details.get(i).describe());
            }
        }
        return sb.toString();
    }
}
