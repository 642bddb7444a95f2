package com.equipmenthealth.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Model verdict for one timestamp. Contributions are present only on anomalous records and keep
 * the order the service reported them in.
 */
public final class AnomalyRecord {
    private final Instant timestamp;
    private final boolean anomaly;
    private final List<DiagnosticContribution> contributions;

    public AnomalyRecord(Instant timestamp, boolean anomaly, List<DiagnosticContribution> contributions) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.anomaly = anomaly;
        List<DiagnosticContribution> safe = contributions == null ? List.of() : List.copyOf(contributions);
        if (!anomaly && !safe.isEmpty()) {
            throw new IllegalArgumentException("Normal record at " + timestamp + " carries diagnostics");
        }
        this.contributions = Collections.unmodifiableList(safe);
    }

    public static AnomalyRecord normal(Instant timestamp) {
        return new AnomalyRecord(timestamp, false, List.of());
    }

    public Instant timestamp() {
        return timestamp;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public List<DiagnosticContribution> contributions() {
        return contributions;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AnomalyRecord)) {
            return false;
        }
        AnomalyRecord that = (AnomalyRecord) other;
        return anomaly == that.anomaly && timestamp.equals(that.timestamp) && contributions.equals(that.contributions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, anomaly, contributions);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" + timestamp + (anomaly ? ", anomaly, " + contributions : ", normal") + "}";
    }
}
