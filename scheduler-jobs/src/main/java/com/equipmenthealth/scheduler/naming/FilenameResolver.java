package com.equipmenthealth.scheduler.naming;

import com.equipmenthealth.scheduler.config.ComponentDelimiter;
import com.equipmenthealth.scheduler.config.ScheduleConfig;
import com.equipmenthealth.scheduler.config.TimestampFormat;
import com.equipmenthealth.scheduler.config.TimezoneOffset;
import com.equipmenthealth.scheduler.config.UploadFrequency;
import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;
import com.equipmenthealth.scheduler.model.TimeRange;
import com.equipmenthealth.scheduler.util.StringSemantics;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives which input file a scheduled run consumes.
 *
 * <p>A run firing at {@code T} reads the window {@code [T - f, T)} from the file stamped
 * {@code T - f}, rendered at the configured timezone offset. The delay offset only moves the
 * instant the scheduler looks ({@code T + delay}); a file stamped earlier than {@code T - f} is
 * never picked up by this run and waits for its own.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class FilenameResolver {
    public static final String FILE_SUFFIX = ".csv";

    private final UploadFrequency uploadFrequency;
    private final Duration delay;
    private final TimezoneOffset timezoneOffset;
    private final ComponentDelimiter delimiter;
    private final TimestampFormat timestampFormat;

    public FilenameResolver(
            UploadFrequency uploadFrequency,
            int delayOffsetMinutes,
            TimezoneOffset timezoneOffset,
            ComponentDelimiter delimiter,
            TimestampFormat timestampFormat) {
        if (uploadFrequency == null || timezoneOffset == null || delimiter == null || timestampFormat == null) {
            throw new InvalidConfigurationException("Resolver options must all be set", ErrorContext.NONE);
        }
        if (delayOffsetMinutes < 0) {
            throw new InvalidConfigurationException(
                    "delay_offset_minutes must be >= 0 but was " + delayOffsetMinutes, ErrorContext.NONE);
        }
        this.uploadFrequency = uploadFrequency;
        this.delay = Duration.ofMinutes(delayOffsetMinutes);
        this.timezoneOffset = timezoneOffset;
        this.delimiter = delimiter;
        this.timestampFormat = timestampFormat;
    }

    public static FilenameResolver forConfig(ScheduleConfig config) {
        return new FilenameResolver(
                config.uploadFrequency,
                config.delayOffsetMinutes,
                config.timezoneOffset,
                config.componentDelimiter,
                config.timestampFormat);
    }

    public UploadFrequency uploadFrequency() {
        return uploadFrequency;
    }

    public TimezoneOffset timezoneOffset() {
        return timezoneOffset;
    }

    public ExpectedInput expectedInput(String component, Instant fireTime) {
        requireComponent(component);
        Objects.requireNonNull(fireTime, "fireTime");
        Instant windowStart = fireTime.minus(uploadFrequency.duration());
        String fileName = component
                + delimiter.symbol()
                + timestampFormat.format(windowStart, timezoneOffset.zoneOffset())
                + FILE_SUFFIX;
        return new ExpectedInput(fireTime, new TimeRange(windowStart, fireTime), fireTime.plus(delay), fileName);
    }

    /**
     * Recovers the file-name timestamp from an object key, or empty when the key does not follow
     * this component's naming convention.
     */
    public Optional<Instant> parseFilenameTimestamp(String component, String objectKey) {
        requireComponent(component);
        String name = StringSemantics.baseName(objectKey);
        String head = component + delimiter.symbol();
        if (!name.startsWith(head) || !name.endsWith(FILE_SUFFIX)) {
            return Optional.empty();
        }
        String stamp = name.substring(head.length(), name.length() - FILE_SUFFIX.length());
        try {
            return Optional.of(timestampFormat.parse(stamp, timezoneOffset.zoneOffset()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    public boolean matches(String component, Instant fireTime, String objectKey) {
        return expectedInput(component, fireTime).fileName().equals(StringSemantics.baseName(objectKey));
    }

    /**
     * Fire time of the run that is looking for input at {@code now}: the delay is taken off first,
     * then the result is floored onto the frequency grid.
     */
    public Instant fireTimeAt(Instant now) {
        return floor(now.minus(delay));
    }

    /**
     * First fire time at or after {@code now}.
     */
    public Instant nextFireTime(Instant now) {
        Instant floor = floor(now);
        return floor.equals(now) ? floor : floor.plus(uploadFrequency.duration());
    }

    private Instant floor(Instant instant) {
        long step = uploadFrequency.duration().getSeconds();
        long seconds = Math.floorDiv(instant.getEpochSecond(), step) * step;
        return Instant.ofEpochSecond(seconds);
    }

    private static void requireComponent(String component) {
        if (StringSemantics.isBlank(component)) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
    }
}
