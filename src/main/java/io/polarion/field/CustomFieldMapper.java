package io.polarion.field;

import io.polarion.error.ValidationException;
import io.polarion.relation.RelationshipRef;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Copies custom fields to and from plain objects whose fields carry {@link CustomField}.
 * Supported field types: String, Long, Integer, Double, Boolean, LocalDate, LocalTime,
 * OffsetDateTime, Duration, TextContent, TableField and RelationshipRef. Primitive fields are
 * rejected because null is how a missing value is represented.
 */
public final class CustomFieldMapper {
    private CustomFieldMapper() {
    }

    /**
     * Assigns every annotated field whose custom field is present; absent or mismatched values
     * leave the target field untouched.
     */
    public static <T> T load(CustomFields fields, T target) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(target, "target");
        for (Field field : annotatedFields(target.getClass())) {
            String key = field.getAnnotation(CustomField.class).value();
            Object value = read(fields, key, field);
            if (value != null) {
                assign(field, target, value);
            }
        }
        return target;
    }

    /**
     * Writes every annotated field; a null field deletes the custom field.
     */
    public static void save(Object source, CustomFields fields) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(fields, "fields");
        for (Field field : annotatedFields(source.getClass())) {
            String key = field.getAnnotation(CustomField.class).value();
            Object value = valueOf(field, source);
            if (value == null) {
                fields.delete(key);
            } else {
                write(fields, key, field, value);
            }
        }
    }

    private static Object read(CustomFields fields, String key, Field field) {
        Class<?> type = field.getType();
        if (type == String.class) {
            return fields.getString(key).orElse(null);
        }
        if (type == Long.class || type == Integer.class) {
            OptionalLong value = fields.getInteger(key);
            if (value.isEmpty()) {
                return null;
            }
            if (type == Long.class) {
                return value.getAsLong();
            }
            long raw = value.getAsLong();
            return raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE ? null : (int) raw;
        }
        if (type == Double.class) {
            return fields.getFloat(key).isPresent() ? fields.getFloat(key).getAsDouble() : null;
        }
        if (type == Boolean.class) {
            return fields.getBoolean(key).orElse(null);
        }
        if (type == LocalDate.class) {
            return fields.getDate(key).orElse(null);
        }
        if (type == LocalTime.class) {
            return fields.getTime(key).orElse(null);
        }
        if (type == OffsetDateTime.class) {
            return fields.getDateTime(key).orElse(null);
        }
        if (type == Duration.class) {
            return fields.getDuration(key).orElse(null);
        }
        if (type == TextContent.class) {
            return fields.getText(key).orElse(null);
        }
        if (type == TableField.class) {
            return fields.getTable(key).orElse(null);
        }
        if (type == RelationshipRef.class) {
            return fields.getRelationship(key).orElse(null);
        }
        throw unsupported(field);
    }

    private static void write(CustomFields fields, String key, Field field, Object value) {
        Class<?> type = field.getType();
        if (type == LocalDate.class) {
            fields.setDate(key, (LocalDate) value);
        } else if (type == LocalTime.class) {
            fields.setTime(key, (LocalTime) value);
        } else if (type == OffsetDateTime.class) {
            fields.setDateTime(key, (OffsetDateTime) value);
        } else if (type == Duration.class) {
            fields.setDuration(key, (Duration) value);
        } else if (type == RelationshipRef.class) {
            fields.setRelationship(key, (RelationshipRef) value);
        } else if (type == String.class
                || type == Long.class
                || type == Integer.class
                || type == Double.class
                || type == Boolean.class
                || type == TextContent.class
                || type == TableField.class) {
            fields.set(key, value);
        } else {
            throw unsupported(field);
        }
    }

    private static List<Field> annotatedFields(Class<?> type) {
        List<Field> out = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || !field.isAnnotationPresent(CustomField.class)) {
                    continue;
                }
                String key = field.getAnnotation(CustomField.class).value();
                if (key == null || key.isBlank()) {
                    throw new ValidationException(field.getName(), "custom field id must not be blank");
                }
                if (field.getType().isPrimitive()) {
                    throw unsupported(field);
                }
                field.setAccessible(true);
                out.add(field);
            }
        }
        return out;
    }

    private static Object valueOf(Field field, Object source) {
        try {
            return field.get(source);
        } catch (IllegalAccessException e) {
            throw new ValidationException(field.getName(), "field is not readable: " + e.getMessage());
        }
    }

    private static void assign(Field field, Object target, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException e) {
            throw new ValidationException(field.getName(), "field is not writable: " + e.getMessage());
        }
    }

    private static ValidationException unsupported(Field field) {
        return new ValidationException(field.getName(), "unsupported field type: " + field.getType().getName());
    }
}
