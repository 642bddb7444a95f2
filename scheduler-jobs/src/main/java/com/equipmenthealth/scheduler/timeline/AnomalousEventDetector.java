package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.AnomalyRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups anomalous records into events. An event ends at a normal record or when the next
 * anomalous record is more than {@code maxGap} after the previous one.
 */
public final class AnomalousEventDetector {
    private AnomalousEventDetector() {}

    /**
     * @param records records in ascending timestamp order
     */
    public static List<AnomalousEvent> detect(List<AnomalyRecord> records, Duration maxGap) {
        List<AnomalousEvent> events = new ArrayList<>();
        Instant start = null;
        Instant last = null;
        int count = 0;
        for (AnomalyRecord record : records) {
            if (!record.isAnomaly()) {
                if (start != null) {
                    events.add(new AnomalousEvent(start, last, count));
                    start = null;
                }
                continue;
            }
            Instant ts = record.timestamp();
            if (start != null && Duration.between(last, ts).compareTo(maxGap) > 0) {
                events.add(new AnomalousEvent(start, last, count));
                start = null;
            }
            if (start == null) {
                start = ts;
                count = 0;
            }
            last = ts;
            count++;
        }
        if (start != null) {
            events.add(new AnomalousEvent(start, last, count));
        }
        return events;
    }
}
