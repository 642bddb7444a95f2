package com.equipmenthealth.scheduler.pipeline;

import com.equipmenthealth.scheduler.error.InvalidConfigurationException;
import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.model.TimeRange;
import com.equipmenthealth.scheduler.util.JsonSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionManifestLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsExecutionsWithDerivedWindows() throws Exception {
        Path manifest = dir.resolve("manifest.json");
        Files.writeString(manifest, "{\"schedule_name\":\"pump-scheduler\",\"upload_frequency\":\"PT10M\","
                + "\"executions\":["
                + "{\"fire_time\":\"2021-01-27T09:20:00Z\",\"status\":\"SUCCESS\","
                + "\"output\":{\"bucket\":\"out\",\"key\":\"pump/results.jsonl\"}},"
                + "{\"fire_time\":\"2021-01-27T09:30:00Z\",\"status\":\"failed\",\"failure_reason\":\"no data found\"}"
                + "]}");

        ExecutionManifest loaded = ExecutionManifestLoader.loadFromFile(manifest);

        assertEquals("pump-scheduler", loaded.scheduleName);
        assertEquals(2, loaded.executions.size());
        ExecutionSummary first = loaded.executions.get(0);
        assertEquals(ExecutionStatus.SUCCESS, first.status());
        assertEquals(new ObjectRef("out", "pump/results.jsonl"), first.output());
        assertEquals(new TimeRange(Instant.parse("2021-01-27T09:10:00Z"), Instant.parse("2021-01-27T09:20:00Z")),
                first.dataWindow());
        assertEquals(ExecutionStatus.FAILED, loaded.executions.get(1).status());
        assertEquals("no data found", loaded.executions.get(1).failureReason());
    }

    @Test
    void explicitWindowWins() throws Exception {
        ExecutionManifest loaded = ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree(
                "{\"schedule_name\":\"s\",\"executions\":[{\"fire_time\":\"2021-01-27T09:20:00Z\","
                        + "\"status\":\"IN_PROGRESS\",\"data_start\":\"2021-01-27T09:00:00Z\","
                        + "\"data_end\":\"2021-01-27T09:20:00Z\"}]}"));

        assertEquals(Instant.parse("2021-01-27T09:00:00Z"), loaded.executions.get(0).dataWindow().start());
    }

    @Test
    void rejectsIncompleteManifests() throws Exception {
        assertThrows(IllegalStateException.class,
                () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree("{\"executions\":[]}")));
        assertThrows(IllegalStateException.class,
                () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree("{\"schedule_name\":\"s\"}")));
        assertThrows(IllegalStateException.class, () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree(
                "{\"schedule_name\":\"s\",\"executions\":[{\"status\":\"SUCCESS\"}]}")));
        assertThrows(InvalidConfigurationException.class, () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree(
                "{\"schedule_name\":\"s\",\"upload_frequency\":\"PT3M\",\"executions\":[]}")));
        assertThrows(IllegalStateException.class,
                () -> ExecutionManifestLoader.loadFromFile(dir.resolve("absent.json")));
    }

    @Test
    void rejectsUnknownStatusAndOutputWithoutKey() {
        IllegalStateException status = assertThrows(IllegalStateException.class,
                () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree(
                        "{\"schedule_name\":\"s\",\"executions\":[{\"fire_time\":\"2021-01-27T09:20:00Z\","
                                + "\"status\":\"DONE\"}]}")));
        assertTrue(status.getMessage().contains("DONE"));

        IllegalStateException output = assertThrows(IllegalStateException.class,
                () -> ExecutionManifestLoader.parse(JsonSupport.MAPPER.readTree(
                        "{\"schedule_name\":\"s\",\"executions\":[{\"fire_time\":\"2021-01-27T09:20:00Z\","
                                + "\"status\":\"SUCCESS\",\"output\":{\"bucket\":\"out\"}}]}")));
        assertTrue(output.getMessage().contains("2021-01-27T09:20:00Z"));
    }
}
