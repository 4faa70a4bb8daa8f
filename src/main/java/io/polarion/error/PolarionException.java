package io.polarion.error;

public class PolarionException extends RuntimeException {
    public PolarionException(String message) {
        super(message);
    }

    public PolarionException(String message, Throwable cause) {
        super(message, cause);
    }
}
