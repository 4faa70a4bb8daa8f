package io.polarion.relation;

import java.util.Objects;
import java.util.Optional;

public record RelationshipRef(
        ResourceKind kind,
        String id,
        String revision
) {
    public RelationshipRef {
        Objects.requireNonNull(kind, "kind");
        id = id == null ? "" : id;
        revision = revision == null || revision.isBlank() ? null : revision;
    }

    public static RelationshipRef of(ResourceKind kind, String id) {
        return new RelationshipRef(kind, id, null);
    }

    public static RelationshipRef user(String userId) {
        return new RelationshipRef(ResourceKind.USER, userId, null);
    }

    public static RelationshipRef workItem(String projectId, String workItemId) {
        return new RelationshipRef(ResourceKind.WORK_ITEM, projectId + "/" + workItemId, null);
    }

    public RelationshipRef withRevision(String value) {
        return new RelationshipRef(kind, id, value);
    }

    public boolean isPresent() {
        return !id.isEmpty();
    }

    public Optional<String> projectId() {
        int slash = id.indexOf('/');
        return slash > 0 ? Optional.of(id.substring(0, slash)) : Optional.empty();
    }

    public String localId() {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }
}
