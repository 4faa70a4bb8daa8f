package io.polarion.field;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FieldFormats {
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+)\\s*([dhms])");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX");

    private FieldFormats() {
    }

    public static LocalTime parseTime(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("empty time string");
        }
        String[] parts = raw.split(":", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("invalid time format: " + raw + " (expected HH:MM:SS)");
        }
        int hour = parseComponent(parts[0], "hour", raw);
        int minute = parseComponent(parts[1], "minute", raw);
        int second = parseComponent(parts[2], "second", raw);
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("invalid hour: " + hour + " (must be 0-23)");
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("invalid minute: " + minute + " (must be 0-59)");
        }
        if (second < 0 || second > 59) {
            throw new IllegalArgumentException("invalid second: " + second + " (must be 0-59)");
        }
        return LocalTime.of(hour, minute, second);
    }

    public static String formatTime(LocalTime time) {
        return String.format("%02d:%02d:%02d", time.getHour(), time.getMinute(), time.getSecond());
    }

    public static LocalDate parseDate(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("empty date string");
        }
        try {
            return LocalDate.parse(raw, DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid date format: " + raw, e);
        }
    }

    public static String formatDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static OffsetDateTime parseDateTime(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("empty datetime string");
        }
        try {
            return OffsetDateTime.parse(raw, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid datetime format: " + raw, e);
        }
    }

    public static String formatDateTime(OffsetDateTime value) {
        return value.format(DATE_TIME);
    }

    /**
     * Parses {@code 2d 3h 30m 15s}; units may appear in any order and repeat.
     */
    public static Duration parseDuration(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("empty duration string");
        }
        Matcher matcher = DURATION_PART.matcher(raw);
        Duration total = Duration.ZERO;
        boolean matched = false;
        while (matcher.find()) {
            matched = true;
            long value;
            try {
                value = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid duration value: " + matcher.group(1), e);
            }
            try {
                total = switch (matcher.group(2)) {
                    case "d" -> total.plusDays(value);
                    case "h" -> total.plusHours(value);
                    case "m" -> total.plusMinutes(value);
                    default -> total.plusSeconds(value);
                };
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("duration out of range: " + raw, e);
            }
        }
        if (!matched) {
            throw new IllegalArgumentException("invalid duration format: " + raw);
        }
        return total;
    }

    public static String formatDuration(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative, got " + duration);
        }
        if (duration.getSeconds() == 0L) {
            return "0s";
        }
        long remaining = duration.getSeconds();
        List<String> parts = new ArrayList<>(4);
        long days = remaining / 86_400L;
        remaining -= days * 86_400L;
        long hours = remaining / 3_600L;
        remaining -= hours * 3_600L;
        long minutes = remaining / 60L;
        long seconds = remaining - minutes * 60L;
        if (days > 0) {
            parts.add(days + "d");
        }
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (minutes > 0) {
            parts.add(minutes + "m");
        }
        if (seconds > 0) {
            parts.add(seconds + "s");
        }
        return String.join(" ", parts);
    }

    private static int parseComponent(String part, String name, String raw) {
        try {
            return Integer.parseInt(part);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + name + " in time: " + raw, e);
        }
    }
}
