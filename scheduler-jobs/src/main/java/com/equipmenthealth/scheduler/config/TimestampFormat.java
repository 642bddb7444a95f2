package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Rendering of the timestamp embedded in input file names.
 *
 * <p>{@link #EPOCH} is signed seconds since the Unix epoch and ignores the timezone offset; the two
 * pattern formats render local wall-clock time at the configured offset.</p>
 */
public enum TimestampFormat {
    EPOCH("EPOCH", null),
    DASHED("yyyy-MM-dd-HH-mm-ss", "uuuu-MM-dd-HH-mm-ss"),
    COMPACT("yyyyMMddHHmmss", "uuuuMMddHHmmss");

    private final String label;
    private final DateTimeFormatter formatter;

    TimestampFormat(String label, String pattern) {
        this.label = label;
        this.formatter = pattern == null
                ? null
                : DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    public String label() {
        return label;
    }

    public String format(Instant instant, ZoneOffset offset) {
        if (this == EPOCH) {
            return Long.toString(instant.getEpochSecond());
        }
        return formatter.format(LocalDateTime.ofInstant(instant, offset));
    }

    /**
     * @throws DateTimeParseException when the text does not follow this format
     */
    public Instant parse(String text, ZoneOffset offset) {
        if (this == EPOCH) {
            String digits = text.startsWith("-") ? text.substring(1) : text;
            if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                throw new DateTimeParseException("Not an epoch-seconds value", text, 0);
            }
            try {
                return Instant.ofEpochSecond(Long.parseLong(text));
            } catch (NumberFormatException ex) {
                throw new DateTimeParseException("Epoch-seconds value out of range", text, 0, ex);
            }
        }
        return LocalDateTime.parse(text, formatter).toInstant(offset);
    }

    public static TimestampFormat parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigurationException("timestamp_format is required", ErrorContext.NONE);
        }
        String value = raw.trim();
        for (TimestampFormat candidate : values()) {
            if (candidate.label.equals(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new InvalidConfigurationException(
                "timestamp_format must be one of EPOCH, yyyy-MM-dd-HH-mm-ss, yyyyMMddHHmmss but was " + raw,
                ErrorContext.NONE);
    }
}
