package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;

import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed offset from UTC used to render file-name timestamps, limited to -12:00..+12:00 in 30-minute steps.
 */
public final class TimezoneOffset {
    public static final TimezoneOffset UTC = new TimezoneOffset(ZoneOffset.UTC);

    private static final Pattern SIGNED_HH_MM = Pattern.compile("([+-])(\\d{2}):(\\d{2})");
    private static final int MAX_MINUTES = 12 * 60;

    private final ZoneOffset offset;

    private TimezoneOffset(ZoneOffset offset) {
        this.offset = offset;
    }

    public ZoneOffset zoneOffset() {
        return offset;
    }

    public static TimezoneOffset parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigurationException("timezone_offset is required", ErrorContext.NONE);
        }
        String value = raw.trim();
        if ("Z".equalsIgnoreCase(value) || "UTC".equalsIgnoreCase(value)) {
            return UTC;
        }
        Matcher m = SIGNED_HH_MM.matcher(value);
        if (!m.matches()) {
            throw new InvalidConfigurationException(
                    "timezone_offset must look like +HH:MM or -HH:MM but was " + raw, ErrorContext.NONE);
        }
        int hours = Integer.parseInt(m.group(2));
        int minutes = Integer.parseInt(m.group(3));
        if (minutes != 0 && minutes != 30) {
            throw new InvalidConfigurationException(
                    "timezone_offset must be a multiple of 30 minutes but was " + raw, ErrorContext.NONE);
        }
        int total = hours * 60 + minutes;
        if (total > MAX_MINUTES) {
            throw new InvalidConfigurationException(
                    "timezone_offset must lie within -12:00..+12:00 but was " + raw, ErrorContext.NONE);
        }
        int signed = "-".equals(m.group(1)) ? -total : total;
        return new TimezoneOffset(ZoneOffset.ofTotalSeconds(signed * 60));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TimezoneOffset && ((TimezoneOffset) other).offset.equals(offset);
    }

    @Override
    public int hashCode() {
        return offset.hashCode();
    }

    @Override
    public String toString() {
        return offset.getTotalSeconds() == 0 ? "+00:00" : offset.getId();
    }
}
