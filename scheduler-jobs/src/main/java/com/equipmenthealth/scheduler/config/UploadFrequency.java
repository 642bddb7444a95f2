package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * How often upstream producers drop a new input file, and therefore how often the schedule fires.
 */
public enum UploadFrequency {
    PT5M(Duration.ofMinutes(5)),
    PT10M(Duration.ofMinutes(10)),
    PT15M(Duration.ofMinutes(15)),
    PT30M(Duration.ofMinutes(30)),
    PT1H(Duration.ofHours(1));

    private final Duration duration;

    UploadFrequency(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }

    public long minutes() {
        return duration.toMinutes();
    }

    /**
     * Accepts an ISO-8601 duration ({@code PT5M}, {@code PT60M}, {@code PT1H}) or a bare minute count.
     */
    public static UploadFrequency parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigurationException("upload_frequency is required", ErrorContext.NONE);
        }
        String value = raw.trim();
        Duration parsed;
        try {
            parsed = value.chars().allMatch(Character::isDigit)
                    ? Duration.ofMinutes(Long.parseLong(value))
                    : Duration.parse(value.toUpperCase(java.util.Locale.ROOT));
        } catch (DateTimeParseException | NumberFormatException ex) {
            throw new InvalidConfigurationException("upload_frequency is not a duration: " + raw, ErrorContext.NONE, ex);
        }
        return fromDuration(parsed);
    }

    public static UploadFrequency fromDuration(Duration duration) {
        for (UploadFrequency candidate : values()) {
            if (candidate.duration.equals(duration)) {
                return candidate;
            }
        }
        throw new InvalidConfigurationException(
                "upload_frequency must be one of PT5M, PT10M, PT15M, PT30M, PT1H but was " + duration,
                ErrorContext.NONE);
    }
}
