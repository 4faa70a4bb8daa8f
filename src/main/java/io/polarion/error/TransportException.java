package io.polarion.error;

public final class TransportException extends PolarionException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
