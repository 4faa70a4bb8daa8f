package io.polarion.field;

import java.util.Optional;

public enum FieldKind {
    STRING("string"),
    TEXT("text"),
    TEXT_HTML("text/html"),
    INTEGER("integer"),
    FLOAT("float"),
    TIME("time"),
    DATE("date"),
    DATE_TIME("date-time"),
    DURATION("duration"),
    BOOLEAN("boolean"),
    ENUMERATION("enumeration"),
    RELATIONSHIP("relationship"),
    CODE("code"),
    STRUCTURE("structure"),
    CURRENCY("currency"),
    // not advertised by the metadata API; inferred from the payload shape
    TABLE("table");

    private final String wireName;

    FieldKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FieldKind> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (FieldKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
