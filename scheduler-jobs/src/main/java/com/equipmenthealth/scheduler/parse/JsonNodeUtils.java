package com.equipmenthealth.scheduler.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Shared JSON helper methods for reading optional fields without throwing.
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node) || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    /**
     * Reads an ISO-8601 timestamp. Values without an offset are taken as UTC.
     *
     * @return the instant, or null when the node is absent, not text, or not ISO-8601
     */
    public static Instant parseIsoInstant(JsonNode node) {
        String raw = asNullableText(node);
        if (raw == null) {
            return null;
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(raw.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * @return the integral value, or null when the node is absent or not an integral number
     */
    public static Long asNullableIntegral(JsonNode node) {
        if (isAbsent(node) || !node.isIntegralNumber() || !node.canConvertToLong()) {
            return null;
        }
        return node.asLong();
    }
}
