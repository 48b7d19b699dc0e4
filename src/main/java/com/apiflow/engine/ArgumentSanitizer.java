package com.apiflow.engine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites call arguments into values the JSON wire format accepts, recursing through nested maps,
 * collections and arrays: binary payloads become standard base64, dates become {@code yyyy-MM-dd},
 * and instants become RFC 3339 timestamps.
 */
public final class ArgumentSanitizer {

    private ArgumentSanitizer() {
    }

    public static Map<String, Object> sanitize(Map<?, ?> arguments) {
        Map<String, Object> clean = new LinkedHashMap<>();
        if (arguments != null) {
            arguments.forEach((name, value) -> clean.put(String.valueOf(name), sanitizeValue(value)));
        }
        return clean;
    }

    static Object sanitizeValue(Object value) {
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime);
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof Map<?, ?> map) {
            return sanitize(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> clean = new ArrayList<>(collection.size());
            collection.forEach(item -> clean.add(sanitizeValue(item)));
            return clean;
        }
        if (value instanceof Object[] array) {
            List<Object> clean = new ArrayList<>(array.length);
            for (Object item : array) {
                clean.add(sanitizeValue(item));
            }
            return clean;
        }
        return value;
    }
}
