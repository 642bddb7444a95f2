package com.equipmenthealth.scheduler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One scheduled inference run as reported by the remote service.
 *
 * <p>The data window is {@code [fireTime - uploadFrequency, fireTime)}. A SUCCESS summary always
 * carries the reference to its output object.</p>
 */
public final class ExecutionSummary {
    private final String scheduleName;
    private final Instant fireTime;
    private final TimeRange dataWindow;
    private final ExecutionStatus status;
    private final ObjectRef output;
    private final String failureReason;

    public ExecutionSummary(
            String scheduleName,
            Instant fireTime,
            TimeRange dataWindow,
            ExecutionStatus status,
            ObjectRef output,
            String failureReason) {
        this.scheduleName = Objects.requireNonNull(scheduleName, "scheduleName");
        this.fireTime = Objects.requireNonNull(fireTime, "fireTime");
        this.dataWindow = Objects.requireNonNull(dataWindow, "dataWindow");
        this.status = Objects.requireNonNull(status, "status");
        if (status == ExecutionStatus.SUCCESS && output == null) {
            throw new IllegalArgumentException("SUCCESS execution at " + fireTime + " has no output reference");
        }
        this.output = output;
        this.failureReason = failureReason;
    }

    public static ExecutionSummary of(
            String scheduleName, Instant fireTime, Duration uploadFrequency, ExecutionStatus status, ObjectRef output) {
        return new ExecutionSummary(
                scheduleName, fireTime, new TimeRange(fireTime.minus(uploadFrequency), fireTime), status, output, null);
    }

    public static ExecutionSummary failed(
            String scheduleName, Instant fireTime, Duration uploadFrequency, String failureReason) {
        return new ExecutionSummary(
                scheduleName,
                fireTime,
                new TimeRange(fireTime.minus(uploadFrequency), fireTime),
                ExecutionStatus.FAILED,
                null,
                failureReason);
    }

    public String scheduleName() {
        return scheduleName;
    }

    public Instant fireTime() {
        return fireTime;
    }

    public TimeRange dataWindow() {
        return dataWindow;
    }

    public ExecutionStatus status() {
        return status;
    }

    public ObjectRef output() {
        return output;
    }

    public String failureReason() {
        return failureReason;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ExecutionSummary)) {
            return false;
        }
        ExecutionSummary that = (ExecutionSummary) other;
        return scheduleName.equals(that.scheduleName)
                && fireTime.equals(that.fireTime)
                && dataWindow.equals(that.dataWindow)
                && status == that.status
                && Objects.equals(output, that.output)
                && Objects.equals(failureReason, that.failureReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheduleName, fireTime, dataWindow, status, output, failureReason);
    }

    @Override
    public String toString() {
        return "ExecutionSummary{schedule=" + scheduleName + ", fireTime=" + fireTime + ", status=" + status
                + (output == null ? "" : ", output=" + output) + "}";
    }
}
