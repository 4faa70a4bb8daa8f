package io.polarion.field;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.polarion.relation.RelationshipRef;
import io.polarion.relation.Relationships;
import io.polarion.util.Jsons;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Getters return an empty result for a missing key, JSON null or a shape that does not fit the
 * requested kind. Not thread-safe.
 */
public final class CustomFields {
    private static final Pattern HEX_FLOAT =
            Pattern.compile("[+-]?0[xX]([0-9a-fA-F]+\\.?[0-9a-fA-F]*|\\.[0-9a-fA-F]+)[pP][+-]?[0-9]+");

    private final ObjectNode fields;

    public CustomFields() {
        this(Jsons.mapper().createObjectNode());
    }

    private CustomFields(ObjectNode fields) {
        this.fields = fields;
    }

    /**
     * Wraps {@code node} without copying; changes made through the view are visible in the node.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CustomFields wrap(ObjectNode node) {
        return new CustomFields(node == null ? Jsons.mapper().createObjectNode() : node);
    }

    public static CustomFields of(Map<String, ?> values) {
        CustomFields out = new CustomFields();
        if (values != null) {
            values.forEach(out::set);
        }
        return out;
    }

    @JsonValue
    public ObjectNode asNode() {
        return fields;
    }

    public Optional<JsonNode> raw(String key) {
        JsonNode value = fields.get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public Optional<String> getString(String key) {
        return raw(key).filter(JsonNode::isTextual).map(JsonNode::asText);
    }

    public Optional<String> getEnum(String key) {
        return getString(key);
    }

    public OptionalLong getInteger(String key) {
        Optional<JsonNode> value = raw(key).filter(JsonNode::isNumber);
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        JsonNode node = value.get();
        if (node.isIntegralNumber() && !node.canConvertToLong()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(node.longValue());
    }

    /**
     * Strings (currency fields arrive this way) are parsed as decimals, hex floats with a binary
     * exponent, or NaN/Inf/Infinity in any case with an optional sign.
     */
    public OptionalDouble getFloat(String key) {
        Optional<JsonNode> value = raw(key);
        if (value.isEmpty()) {
            return OptionalDouble.empty();
        }
        JsonNode node = value.get();
        if (node.isNumber()) {
            return OptionalDouble.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(parseFloat(node.asText()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public Optional<Boolean> getBoolean(String key) {
        return raw(key).filter(JsonNode::isBoolean).map(JsonNode::booleanValue);
    }

    public Optional<TextContent> getText(String key) {
        return raw(key).filter(JsonNode::isObject).map(CustomFields::toText);
    }

    public Optional<LocalTime> getTime(String key) {
        return getString(key).flatMap(parsed(FieldFormats::parseTime));
    }

    public Optional<LocalDate> getDate(String key) {
        return getString(key).flatMap(parsed(FieldFormats::parseDate));
    }

    public Optional<OffsetDateTime> getDateTime(String key) {
        return getString(key).flatMap(parsed(FieldFormats::parseDateTime));
    }

    public Optional<Duration> getDuration(String key) {
        return getString(key).flatMap(parsed(FieldFormats::parseDuration));
    }

    public Optional<TableField> getTable(String key) {
        return raw(key).filter(JsonNode::isObject).map(CustomFields::toTable);
    }

    public Optional<RelationshipRef> getRelationship(String key) {
        return Relationships.decode(fields.get(key));
    }

    public List<RelationshipRef> getRelationships(String key) {
        return Relationships.decodeAll(fields.get(key));
    }

    public void set(String key, Object value) {
        if (value == null) {
            fields.set(key, NullNode.getInstance());
            return;
        }
        JsonNode node = value instanceof JsonNode ? (JsonNode) value : Jsons.mapper().valueToTree(value);
        fields.set(key, node);
    }

    public void setTime(String key, LocalTime value) {
        setFormatted(key, value, FieldFormats::formatTime);
    }

    public void setDate(String key, LocalDate value) {
        setFormatted(key, value, FieldFormats::formatDate);
    }

    public void setDateTime(String key, OffsetDateTime value) {
        setFormatted(key, value, FieldFormats::formatDateTime);
    }

    public void setDuration(String key, Duration value) {
        setFormatted(key, value, FieldFormats::formatDuration);
    }

    /**
     * Writes the {@code {"data": {...}}} form; an absent reference or empty id removes the key.
     */
    public void setRelationship(String key, RelationshipRef ref) {
        Relationships.encode(ref).ifPresentOrElse(node -> fields.set(key, node), () -> fields.remove(key));
    }

    public void setRelationships(String key, List<RelationshipRef> refs) {
        Relationships.encodeAll(refs).ifPresentOrElse(node -> fields.set(key, node), () -> fields.remove(key));
    }

    public boolean has(String key) {
        return fields.has(key);
    }

    public void delete(String key) {
        fields.remove(key);
    }

    public List<String> keys() {
        List<String> out = new ArrayList<>(fields.size());
        fields.fieldNames().forEachRemaining(out::add);
        return out;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public CustomFields copy() {
        return new CustomFields(fields.deepCopy());
    }

    private <T> void setFormatted(String key, T value, Function<T, String> formatter) {
        if (value == null) {
            fields.set(key, NullNode.getInstance());
        } else {
            fields.put(key, formatter.apply(value));
        }
    }

    private static double parseFloat(String raw) {
        boolean negative = raw.startsWith("-");
        String unsigned = negative || raw.startsWith("+") ? raw.substring(1) : raw;
        String lower = unsigned.toLowerCase(Locale.ROOT);
        if ("nan".equals(lower)) {
            return Double.NaN;
        }
        if ("inf".equals(lower) || "infinity".equals(lower)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (HEX_FLOAT.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        return new BigDecimal(raw).doubleValue();
    }

    private static <T> Function<String, Optional<T>> parsed(Function<String, T> parser) {
        return raw -> {
            try {
                return Optional.of(parser.apply(raw));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        };
    }

    static TextContent toText(JsonNode node) {
        if (node == null || !node.isObject()) {
            return TextContent.empty();
        }
        return new TextContent(textMember(node, "type"), textMember(node, "value"));
    }

    static TableField toTable(JsonNode node) {
        List<String> keys = new ArrayList<>();
        JsonNode keysNode = node.get("keys");
        if (keysNode != null && keysNode.isArray()) {
            for (JsonNode key : keysNode) {
                keys.add(key.isTextual() ? key.asText() : "");
            }
        }
        List<TableRow> rows = new ArrayList<>();
        JsonNode rowsNode = node.get("rows");
        if (rowsNode != null && rowsNode.isArray()) {
            for (JsonNode row : rowsNode) {
                rows.add(toRow(row));
            }
        }
        return new TableField(keys, rows);
    }

    private static TableRow toRow(JsonNode row) {
        JsonNode values = row.isObject() ? row.get("values") : null;
        if (values == null || !values.isArray()) {
            return TableRow.empty();
        }
        List<TextContent> cells = new ArrayList<>(values.size());
        Iterator<JsonNode> it = values.elements();
        while (it.hasNext()) {
            cells.add(toText(it.next()));
        }
        return new TableRow(cells);
    }

    private static String textMember(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CustomFields)) {
            return false;
        }
        return fields.equals(((CustomFields) other).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
