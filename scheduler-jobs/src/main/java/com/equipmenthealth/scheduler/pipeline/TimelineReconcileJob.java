package com.equipmenthealth.scheduler.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.equipmenthealth.scheduler.config.SchedulerRuntimeConfig;
import com.equipmenthealth.scheduler.remote.ObjectStore;
import com.equipmenthealth.scheduler.storage.FsObjectStore;
import com.equipmenthealth.scheduler.timeline.AggregationReport;
import com.equipmenthealth.scheduler.timeline.ContributionBaseline;
import com.equipmenthealth.scheduler.timeline.ExecutionFailure;
import com.equipmenthealth.scheduler.timeline.ResultAggregator;
import com.equipmenthealth.scheduler.timeline.SensorRanking;
import com.equipmenthealth.scheduler.timeline.Timeline;
import com.equipmenthealth.scheduler.timeline.TimelineWriter;
import com.equipmenthealth.scheduler.util.BuildMetadata;
import com.equipmenthealth.scheduler.util.JsonSupport;
import com.equipmenthealth.scheduler.util.StringSemantics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Offline reconciliation: merges the outputs listed in an execution manifest into one timeline.
 *
 * <p>Inputs come from the environment: {@code RECONCILE_MANIFEST} (manifest JSON path),
 * {@code RECONCILE_STORE_ROOT} (directory holding one sub-directory per bucket),
 * {@code RECONCILE_OUTPUT} (timeline JSON Lines path) and optionally {@code RECONCILE_SENSOR_COUNT}
 * to log the top-ranked sensors. The pass summary is written next to the output as
 * {@code <output>.summary.json}. Exit status 2 means at least one execution was rejected.</p>
 */
public class TimelineReconcileJob {
    private static final Logger LOG = LoggerFactory.getLogger(TimelineReconcileJob.class);

    private static final int TOP_SENSORS = 5;

    public static void main(String[] args) throws Exception {
        Path manifestPath = Path.of(envOrDefault("RECONCILE_MANIFEST", "manifest.json"));
        Path storeRoot = Path.of(envOrDefault("RECONCILE_STORE_ROOT", "."));
        Path output = Path.of(envOrDefault("RECONCILE_OUTPUT", "timeline.jsonl"));
        Integer sensorCount = envInt("RECONCILE_SENSOR_COUNT");
        SchedulerRuntimeConfig runtime = SchedulerRuntimeConfig.fromEnv();

        LOG.info("Starting timeline reconcile build={} manifest={} storeRoot={} output={} parallelism={}",
                BuildMetadata.identity(), manifestPath, storeRoot, output, runtime.aggregationParallelism);

        ExecutionManifest manifest = ExecutionManifestLoader.loadFromFile(manifestPath);
        Timeline timeline = new Timeline(manifest.scheduleName);
        AggregationReport report = run(manifest, new FsObjectStore(storeRoot), runtime.aggregationParallelism, timeline);

        try (OutputStream out = Files.newOutputStream(output)) {
            TimelineWriter.write(timeline, out);
        }
        Path summaryPath = output.resolveSibling(output.getFileName() + ".summary.json");
        Files.writeString(summaryPath, JsonSupport.toJson(summaryNode(manifest.scheduleName, report, timeline)));
        LOG.info("Wrote {} records to {} and pass summary to {}", timeline.size(), output, summaryPath);

        if (sensorCount != null && sensorCount > 0) {
            logTopSensors(timeline, sensorCount);
        }
        if (!report.rejected.isEmpty()) {
            System.exit(2);
        }
    }

    static AggregationReport run(ExecutionManifest manifest, ObjectStore store, int parallelism, Timeline timeline) {
        try (ResultAggregator aggregator = new ResultAggregator(store, parallelism)) {
            return aggregator.aggregate(timeline, manifest.executions);
        }
    }

    static ObjectNode summaryNode(String scheduleName, AggregationReport report, Timeline timeline) {
        ObjectNode root = JsonSupport.MAPPER.createObjectNode();
        root.put("schedule_name", scheduleName);
        root.put("build", BuildMetadata.identity());
        root.put("timeline_size", timeline.size());
        root.put("records_added", report.recordsAdded);
        root.put("in_progress_skipped", report.inProgressSkipped);
        root.put("already_merged", report.alreadyMerged);
        ArrayNode merged = root.putArray("merged");
        for (Instant fireTime : report.merged) {
            merged.add(fireTime.toString());
        }
        ArrayNode remoteFailed = root.putArray("remote_failed");
        report.remoteFailed.forEach(summary -> {
            ObjectNode node = remoteFailed.addObject();
            node.put("fire_time", summary.fireTime().toString());
            node.put("failure_reason", summary.failureReason());
        });
        ArrayNode rejected = root.putArray("rejected");
        for (ExecutionFailure failure : report.rejected) {
            ObjectNode node = rejected.addObject();
            node.put("fire_time", failure.execution.fireTime().toString());
            node.put("failure_class", failure.failureClass);
            node.put("details", failure.details);
        }
        return root;
    }

    private static void logTopSensors(Timeline timeline, int sensorCount) {
        List<SensorRanking.SensorScore> scores = SensorRanking.rank(
                timeline.anomalies(), ContributionBaseline.forSensorCount(sensorCount));
        scores.stream().limit(TOP_SENSORS).forEach(score -> LOG.info(
                "Sensor {} mean={} occurrences={} aboveBaseline={}",
                score.sensorName, score.meanContribution, score.occurrences, score.aboveBaseline));
    }

    private static String envOrDefault(String key, String fallback) {
        String value = StringSemantics.blankToNull(System.getenv(key));
        return value == null ? fallback : value;
    }

    private static Integer envInt(String key) {
        String value = StringSemantics.blankToNull(System.getenv(key));
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring non-numeric {}={}", key, value);
            return null;
        }
    }
}
