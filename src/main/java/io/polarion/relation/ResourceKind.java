package io.polarion.relation;

import java.util.Optional;

public enum ResourceKind {
    USER("users"),
    WORK_ITEM("workitems"),
    DOCUMENT("documents"),
    CATEGORY("categories"),
    PLAN("plans"),
    COLLECTION("collections"),
    COMMENT("workitem_comments"),
    ATTACHMENT("workitem_attachments"),
    PROJECT("projects"),
    LINKED_WORK_ITEM("linkedworkitems");

    private final String type;

    ResourceKind(String type) {
        this.type = type;
    }

    /**
     * The JSON:API {@code type} member for this kind.
     */
    public String type() {
        return type;
    }

    public static Optional<ResourceKind> fromType(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (ResourceKind value : values()) {
            if (value.type.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
