package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.DiagnosticContribution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranks sensors by their mean contribution over the anomalous records of a period. A sensor
 * missing from a record counts as contributing 0 to it.
 */
public final class SensorRanking {
    private SensorRanking() {}

    public static List<SensorScore> rank(Collection<AnomalyRecord> records, ContributionBaseline baseline) {
        Map<String, double[]> totals = new TreeMap<>();
        int anomalous = 0;
        for (AnomalyRecord record : records) {
            if (!record.isAnomaly()) {
                continue;
            }
            anomalous++;
            for (DiagnosticContribution contribution : record.contributions()) {
                double[] acc = totals.computeIfAbsent(contribution.sensorName(), name -> new double[2]);
                acc[0] += contribution.fraction();
                acc[1] += 1;
            }
        }
        List<SensorScore> scores = new ArrayList<>(totals.size());
        for (Map.Entry<String, double[]> entry : totals.entrySet()) {
            double mean = entry.getValue()[0] / anomalous;
            scores.add(new SensorScore(entry.getKey(), mean, (int) entry.getValue()[1], baseline.isAboveBaseline(mean)));
        }
        scores.sort(Comparator.comparingDouble((SensorScore s) -> s.meanContribution).reversed()
                .thenComparing(s -> s.sensorName));
        return scores;
    }

    public static final class SensorScore {
        public final String sensorName;
        public final double meanContribution;
        public final int occurrences;
        public final boolean aboveBaseline;

        SensorScore(String sensorName, double meanContribution, int occurrences, boolean aboveBaseline) {
            this.sensorName = sensorName;
            this.meanContribution = meanContribution;
            this.occurrences = occurrences;
            this.aboveBaseline = aboveBaseline;
        }

        @Override
        public String toString() {
            return sensorName + "=" + meanContribution + (aboveBaseline ? " (above baseline)" : "");
        }
    }
}
