package com.equipmenthealth.scheduler.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import com.equipmenthealth.scheduler.config.UploadFrequency;
import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.model.TimeRange;
import com.equipmenthealth.scheduler.parse.JsonNodeUtils;
import com.equipmenthealth.scheduler.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads an execution manifest:
 *
 * <pre>
 * { "schedule_name": "pump-scheduler", "upload_frequency": "PT5M",
 *   "executions": [ { "fire_time": "2021-01-27T09:15:00Z", "status": "SUCCESS",
 *                     "output": { "bucket": "out", "key": "pump/2021-01-27T09:15/results.jsonl" } } ] }
 * </pre>
 *
 * Each execution may carry explicit {@code data_start}/{@code data_end}; otherwise the window is
 * derived from {@code upload_frequency}.
 */
public final class ExecutionManifestLoader {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(ExecutionManifestLoader.class);

    private ExecutionManifestLoader() {}

    public static ExecutionManifest loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Execution manifest not found: " + path);
        }
        try {
            ExecutionManifest manifest = parse(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded manifest for schedule={} executions={} from {}",
                    manifest.scheduleName, manifest.executions.size(), path);
            return manifest;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read execution manifest: " + path, ex);
        }
    }

    static ExecutionManifest parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Execution manifest is not a JSON object");
        }
        String scheduleName = JsonNodeUtils.asNullableText(root.get("schedule_name"));
        if (scheduleName == null) {
            throw new IllegalStateException("Execution manifest missing schedule_name");
        }
        Duration frequency = UploadFrequency.parse(root.path("upload_frequency").asText("PT5M")).duration();
        JsonNode executions = root.path("executions");
        if (!executions.isArray()) {
            throw new IllegalStateException("Execution manifest missing executions array");
        }

        List<ExecutionSummary> summaries = new ArrayList<>();
        for (JsonNode node : executions) {
            Instant fireTime = JsonNodeUtils.parseIsoInstant(node.get("fire_time"));
            if (fireTime == null) {
                throw new IllegalStateException("Manifest execution without a valid fire_time: " + node);
            }
            ExecutionStatus status = parseStatus(node.path("status").asText("IN_PROGRESS"), fireTime);
            Instant dataStart = JsonNodeUtils.parseIsoInstant(node.get("data_start"));
            Instant dataEnd = JsonNodeUtils.parseIsoInstant(node.get("data_end"));
            TimeRange window = dataStart != null && dataEnd != null
                    ? new TimeRange(dataStart, dataEnd)
                    : new TimeRange(fireTime.minus(frequency), fireTime);
            JsonNode output = node.path("output");
            ObjectRef ref = null;
            if (output.isObject()) {
                String bucket = JsonNodeUtils.asNullableText(output.get("bucket"));
                String key = JsonNodeUtils.asNullableText(output.get("key"));
                if (bucket == null || key == null) {
                    throw new IllegalStateException("Manifest execution " + fireTime + " has output without bucket and key");
                }
                ref = new ObjectRef(bucket, key);
            }
            summaries.add(new ExecutionSummary(
                    scheduleName, fireTime, window, status, ref,
                    JsonNodeUtils.asNullableText(node.get("failure_reason"))));
        }
        return new ExecutionManifest(scheduleName, summaries);
    }

    private static ExecutionStatus parseStatus(String raw, Instant fireTime) {
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (ExecutionStatus status : ExecutionStatus.values()) {
            if (status.name().equals(value)) {
                return status;
            }
        }
        throw new IllegalStateException("Manifest execution " + fireTime + " has unknown status: " + raw);
    }
}
