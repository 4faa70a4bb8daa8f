package io.polarion.relation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.polarion.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class Relationships {
    private Relationships() {
    }

    public static Optional<RelationshipRef> decode(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            // legacy encoding: a bare user id
            String id = value.asText();
            return id.isEmpty() ? Optional.empty() : Optional.of(RelationshipRef.user(id));
        }
        JsonNode data = value.isObject() ? value.get("data") : null;
        if (data == null) {
            return Optional.empty();
        }
        if (data.isObject()) {
            return decodeResource(data);
        }
        if (data.isArray()) {
            for (JsonNode item : data) {
                Optional<RelationshipRef> ref = decodeResource(item);
                if (ref.isPresent()) {
                    return ref;
                }
            }
        }
        return Optional.empty();
    }

    public static List<RelationshipRef> decodeAll(JsonNode value) {
        List<RelationshipRef> out = new ArrayList<>();
        if (value == null || !value.isObject()) {
            return out;
        }
        JsonNode data = value.get("data");
        if (data == null) {
            return out;
        }
        if (data.isObject()) {
            decodeResource(data).ifPresent(out::add);
        } else if (data.isArray()) {
            for (JsonNode item : data) {
                decodeResource(item).ifPresent(out::add);
            }
        }
        return out;
    }

    /**
     * Encodes a single reference, or returns empty when it is absent or has an empty id.
     */
    public static Optional<ObjectNode> encode(RelationshipRef ref) {
        if (ref == null || !ref.isPresent()) {
            return Optional.empty();
        }
        ObjectNode envelope = Jsons.mapper().createObjectNode();
        envelope.set("data", resourceNode(ref));
        return Optional.of(envelope);
    }

    public static Optional<ObjectNode> encodeAll(List<RelationshipRef> refs) {
        if (refs == null || refs.isEmpty()) {
            return Optional.empty();
        }
        ArrayNode data = Jsons.mapper().createArrayNode();
        for (RelationshipRef ref : refs) {
            if (ref != null && ref.isPresent()) {
                data.add(resourceNode(ref));
            }
        }
        if (data.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode envelope = Jsons.mapper().createObjectNode();
        envelope.set("data", data);
        return Optional.of(envelope);
    }

    private static Optional<RelationshipRef> decodeResource(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode type = node.get("type");
        JsonNode id = node.get("id");
        if (type == null || !type.isTextual() || id == null || !id.isTextual() || id.asText().isEmpty()) {
            return Optional.empty();
        }
        Optional<ResourceKind> kind = ResourceKind.fromType(type.asText());
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        JsonNode revision = node.get("revision");
        String rev = revision != null && revision.isTextual() ? revision.asText() : null;
        return Optional.of(new RelationshipRef(kind.get(), id.asText(), rev));
    }

    private static ObjectNode resourceNode(RelationshipRef ref) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("type", ref.kind().type());
        node.put("id", ref.id());
        if (ref.revision() != null) {
            node.put("revision", ref.revision());
        }
        return node;
    }
}
