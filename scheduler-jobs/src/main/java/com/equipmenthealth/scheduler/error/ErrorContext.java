package com.equipmenthealth.scheduler.error;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates the artifact an error refers to: schedule, execution fire time and object key, each optional.
 */
public final class ErrorContext {
    public static final ErrorContext NONE = new ErrorContext(null, null, null);

    private final String scheduleName;
    private final Instant fireTime;
    private final String objectKey;

    private ErrorContext(String scheduleName, Instant fireTime, String objectKey) {
        this.scheduleName = scheduleName;
        this.fireTime = fireTime;
        this.objectKey = objectKey;
    }

    public static ErrorContext schedule(String scheduleName) {
        return new ErrorContext(scheduleName, null, null);
    }

    public static ErrorContext execution(String scheduleName, Instant fireTime, String objectKey) {
        return new ErrorContext(scheduleName, fireTime, objectKey);
    }

    public static ErrorContext object(String objectKey) {
        return new ErrorContext(null, null, objectKey);
    }

    public String scheduleName() {
        return scheduleName;
    }

    public Instant fireTime() {
        return fireTime;
    }

    public String objectKey() {
        return objectKey;
    }

    public boolean isEmpty() {
        return scheduleName == null && fireTime == null && objectKey == null;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>(3);
        if (scheduleName != null) {
            parts.add("schedule=" + scheduleName);
        }
        if (fireTime != null) {
            parts.add("fireTime=" + fireTime);
        }
        if (objectKey != null) {
            parts.add("key=" + objectKey);
        }
        return String.join(", ", parts);
    }
}
