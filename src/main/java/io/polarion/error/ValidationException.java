package io.polarion.error;

public final class ValidationException extends PolarionException {
    private final String field;

    public ValidationException(String field, String message) {
        super("validation error: " + field + " - " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
