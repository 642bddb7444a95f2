package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.DiagnosticContribution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Uniform-weight baseline {@code 1 / sensorCount}: a sensor contributing more than its even share
 * is considered significant for the anomaly.
 */
public final class ContributionBaseline {
    private final int sensorCount;
    private final double threshold;

    private ContributionBaseline(int sensorCount) {
        this.sensorCount = sensorCount;
        this.threshold = 1.0 / sensorCount;
    }

    public static ContributionBaseline forSensorCount(int sensorCount) {
        if (sensorCount < 1) {
            throw new IllegalArgumentException("Sensor count must be positive: " + sensorCount);
        }
        return new ContributionBaseline(sensorCount);
    }

    public int sensorCount() {
        return sensorCount;
    }

    public double threshold() {
        return threshold;
    }

    public boolean isAboveBaseline(double fraction) {
        return fraction > threshold;
    }

    public boolean isAboveBaseline(DiagnosticContribution contribution) {
        return isAboveBaseline(contribution.fraction());
    }

    /**
     * Contributions of the record above the baseline, largest first.
     */
    public List<DiagnosticContribution> aboveBaseline(AnomalyRecord record) {
        List<DiagnosticContribution> out = new ArrayList<>();
        for (DiagnosticContribution contribution : record.contributions()) {
            if (isAboveBaseline(contribution)) {
                out.add(contribution);
            }
        }
        out.sort(Comparator.comparingDouble(DiagnosticContribution::fraction).reversed()
                .thenComparing(DiagnosticContribution::sensorName));
        return out;
    }
}
