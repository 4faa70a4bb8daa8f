package io.polarion.model;

public record Hyperlink(
        String uri,
        String role
) {
}
