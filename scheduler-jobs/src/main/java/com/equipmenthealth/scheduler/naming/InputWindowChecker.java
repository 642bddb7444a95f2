package com.equipmenthealth.scheduler.naming;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.TransportFailureException;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.model.TimeRange;
import com.equipmenthealth.scheduler.remote.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Opens a staged input CSV and counts rows whose first column lies inside the run's window.
 *
 * <p>The first column is read as an ISO-8601 timestamp with offset, or as a local
 * {@code yyyy-MM-dd HH:mm:ss} / {@code yyyy-MM-ddTHH:mm:ss} time at the schedule's timezone
 * offset. A first line that does not parse is treated as the header.</p>
 */
public final class InputWindowChecker {
    private static final Logger LOG = LoggerFactory.getLogger(InputWindowChecker.class);
    private static final DateTimeFormatter CELL_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter(Locale.ROOT);

    private final ObjectStore store;
    private final FilenameResolver resolver;

    public InputWindowChecker(ObjectStore store, FilenameResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    public InputWindowCheck check(String inputBucket, String inputPrefix, String component, Instant fireTime) {
        ExpectedInput expected = resolver.expectedInput(component, fireTime);
        ObjectRef ref = new ObjectRef(inputBucket, expected.objectKey(inputPrefix));
        return check(ref, expected.window());
    }

    public InputWindowCheck check(ObjectRef ref, TimeRange window) {
        ZoneOffset offset = resolver.timezoneOffset().zoneOffset();
        long inWindow = 0;
        long outside = 0;
        long unparsable = 0;
        try (InputStream in = store.getObject(ref);
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Instant ts = parseFirstColumn(line, offset);
                if (ts == null) {
                    if (!first) {
                        unparsable++;
                    }
                } else if (window.contains(ts)) {
                    inWindow++;
                } else {
                    outside++;
                }
                first = false;
            }
        } catch (IOException ex) {
            throw new TransportFailureException("GetObject", ErrorContext.object(ref.key()), ex);
        }
        InputWindowCheck result = new InputWindowCheck(ref, window, inWindow, outside, unparsable);
        if (!result.hasData()) {
            LOG.warn("Input {} has no rows inside {} ({} outside, {} unparsable)", ref, window, outside, unparsable);
        } else {
            LOG.debug("Input check {}", result);
        }
        return result;
    }

    static Instant parseFirstColumn(String line, ZoneOffset offset) {
        int comma = line.indexOf(',');
        String cell = (comma < 0 ? line : line.substring(0, comma)).trim();
        if (cell.length() > 1 && cell.startsWith("\"") && cell.endsWith("\"")) {
            cell = cell.substring(1, cell.length() - 1);
        }
        if (cell.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = CELL_TIMESTAMP.parseBest(cell, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(offset);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
