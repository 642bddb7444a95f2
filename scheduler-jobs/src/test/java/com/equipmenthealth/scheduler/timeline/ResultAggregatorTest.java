package com.equipmenthealth.scheduler.timeline;

import com.equipmenthealth.scheduler.model.ExecutionStatus;
import com.equipmenthealth.scheduler.model.ExecutionSummary;
import com.equipmenthealth.scheduler.model.ObjectRef;
import com.equipmenthealth.scheduler.storage.FsObjectStore;
import com.equipmenthealth.scheduler.support.InMemoryObjectStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.equipmenthealth.scheduler.timeline.TimelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {
    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final ResultAggregator aggregator = new ResultAggregator(store, 3);

    @AfterEach
    void closeAggregator() {
        aggregator.close();
    }

    private void stage(int fireMinutes, String content) {
        store.put("out", output(fireMinutes).key(), content);
    }

    @Test
    void mergesSuccessfulExecutionsAndSkipsTheRest() {
        stage(5, normalJsonLines(5));
        stage(10, normalJsonLines(10));
        Timeline timeline = new Timeline(SCHEDULE);
        ExecutionSummary failed = ExecutionSummary.failed(SCHEDULE, at(15), FREQUENCY, "no data found");
        ExecutionSummary running = ExecutionSummary.of(SCHEDULE, at(20), FREQUENCY, ExecutionStatus.IN_PROGRESS, null);

        AggregationReport report = aggregator.aggregate(timeline, List.of(success(10), failed, running, success(5)));

        assertTrue(report.isClean());
        assertEquals(List.of(at(5), at(10)), report.merged);
        assertEquals(10, report.recordsAdded);
        assertEquals(List.of(failed), report.remoteFailed);
        assertEquals(1, report.inProgressSkipped);
        assertEquals(10, timeline.size());
        assertEquals(2, store.reads().size());
    }

    @Test
    void secondPassDoesNotRefetchMergedExecutions() {
        stage(5, normalJsonLines(5));
        Timeline timeline = new Timeline(SCHEDULE);
        aggregator.aggregate(timeline, List.of(success(5)));

        AggregationReport again = aggregator.aggregate(timeline, List.of(success(5)));

        assertEquals(1, again.alreadyMerged);
        assertEquals(0, again.recordsAdded);
        assertEquals(1, store.reads().size());
    }

    @Test
    void malformedArtifactRejectsOnlyThatExecution() {
        stage(5, normalJsonLines(5));
        stage(10, "{\"timestamp\":\"2021-01-27T09:06:00Z\",\"prediction\":7}\n");
        Timeline timeline = new Timeline(SCHEDULE);

        AggregationReport report = aggregator.aggregate(timeline, List.of(success(5), success(10)));

        assertFalse(report.isClean());
        assertEquals(List.of(at(5)), report.merged);
        assertEquals(1, report.rejected.size());
        assertEquals("MALFORMED_RESULT", report.rejected.get(0).failureClass);
        assertEquals(at(10), report.rejected.get(0).execution.fireTime());
        assertFalse(timeline.isMerged(at(10)));
    }

    @Test
    void overlappingExecutionIsReportedAsInconsistent() {
        stage(5, normalJsonLines(5));
        stage(10, normalJsonLines(10) + "{\"timestamp\":\"" + at(4) + "\",\"prediction\":0}\n");
        Timeline timeline = new Timeline(SCHEDULE);

        AggregationReport report = aggregator.aggregate(timeline, List.of(success(5), success(10)));

        assertEquals(List.of(at(5)), report.merged);
        assertEquals("INCONSISTENT_TIMELINE", report.rejected.get(0).failureClass);
        assertEquals(5, timeline.size());
    }

    @Test
    void missingOutputIsATransportFailureForThatExecution() {
        Timeline timeline = new Timeline(SCHEDULE);

        AggregationReport report = aggregator.aggregate(timeline, List.of(success(5)));

        assertEquals("TRANSPORT_FAILURE", report.rejected.get(0).failureClass);
        assertTrue(timeline.isEmpty());
    }

    @Test
    void unexpectedStoreExceptionRejectsOnlyThatExecution() {
        stage(5, normalJsonLines(5));
        stage(15, normalJsonLines(15));
        ObjectRef broken = output(10);
        try (ResultAggregator flaky = new ResultAggregator(ref -> {
            if (ref.equals(broken)) {
                throw new UncheckedIOException(new IOException("connection reset"));
            }
            return store.getObject(ref);
        }, 2)) {
            Timeline timeline = new Timeline(SCHEDULE);

            AggregationReport report = flaky.aggregate(timeline, List.of(success(5), success(10), success(15)));

            assertEquals(List.of(at(5), at(15)), report.merged);
            assertEquals(1, report.rejected.size());
            assertEquals("TRANSPORT_FAILURE", report.rejected.get(0).failureClass);
            assertEquals(at(10), report.rejected.get(0).execution.fireTime());
            assertTrue(report.rejected.get(0).details.contains("connection reset"));
            assertEquals(10, timeline.size());
        }
    }

    @Test
    void keyEscapingTheFileStoreIsReportedPerExecution(@TempDir Path root) throws Exception {
        Path staged = root.resolve(output(5).bucket()).resolve(output(5).key());
        Files.createDirectories(staged.getParent());
        Files.writeString(staged, normalJsonLines(5));
        ExecutionSummary escaping = ExecutionSummary.of(SCHEDULE, at(10), FREQUENCY, ExecutionStatus.SUCCESS,
                new ObjectRef("out", "../../etc/passwd"));
        try (ResultAggregator onDisk = new ResultAggregator(new FsObjectStore(root), 2)) {
            Timeline timeline = new Timeline(SCHEDULE);

            AggregationReport report = onDisk.aggregate(timeline, List.of(success(5), escaping));

            assertEquals(List.of(at(5)), report.merged);
            assertEquals("TRANSPORT_FAILURE", report.rejected.get(0).failureClass);
            assertEquals(5, timeline.size());
        }
    }
}
