package com.equipmenthealth.scheduler.naming;

import com.equipmenthealth.scheduler.model.TimeRange;
import com.equipmenthealth.scheduler.util.StringSemantics;

import java.time.Instant;

/**
 * The input file one scheduled run consumes, and when the scheduler looks for it.
 */
public final class ExpectedInput {
    private final Instant fireTime;
    private final TimeRange window;
    private final Instant searchInstant;
    private final String fileName;

    ExpectedInput(Instant fireTime, TimeRange window, Instant searchInstant, String fileName) {
        this.fireTime = fireTime;
        this.window = window;
        this.searchInstant = searchInstant;
        this.fileName = fileName;
    }

    public Instant fireTime() {
        return fireTime;
    }

    /**
     * Data window {@code [fireTime - frequency, fireTime)}.
     */
    public TimeRange window() {
        return window;
    }

    /**
     * Timestamp embedded in the file name: the start of the window, never the fire time itself.
     */
    public Instant filenameTimestamp() {
        return window.start();
    }

    /**
     * Fire time plus the delay offset. The delay only moves this instant; it never changes the file.
     */
    public Instant searchInstant() {
        return searchInstant;
    }

    /**
     * {@code <component><delimiter><timestamp>.csv}
     */
    public String fileName() {
        return fileName;
    }

    public String objectKey(String inputPrefix) {
        return StringSemantics.joinKey(inputPrefix, fileName);
    }

    @Override
    public String toString() {
        return "ExpectedInput{fireTime=" + fireTime + ", window=" + window + ", file=" + fileName + "}";
    }
}
