package com.equipmenthealth.scheduler.parse;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.MalformedResultException;
import com.equipmenthealth.scheduler.model.AnomalyRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyResultParserTest {
    private static final ErrorContext CONTEXT = ErrorContext.execution(
            "pump-scheduler", Instant.parse("2021-01-27T09:15:00Z"), "pump/results.jsonl");

    private final AnomalyResultParser parser = new AnomalyResultParser();

    @Test
    void parsesJsonLines() {
        String content = "{\"timestamp\":\"2021-01-27T09:10:00.000000\",\"prediction\":0}\n"
                + "\n"
                + "{\"timestamp\":\"2021-01-27T09:11:00.000000\",\"prediction\":1,"
                + "\"diagnostics\":[{\"name\":\"pump\\\\temp\",\"value\":0.7},{\"name\":\"pump\\\\flow\",\"value\":0.3}]}\n";

        List<AnomalyRecord> records = parser.parse(content, CONTEXT);

        assertEquals(2, records.size());
        assertFalse(records.get(0).isAnomaly());
        assertEquals(Instant.parse("2021-01-27T09:10:00Z"), records.get(0).timestamp());
        AnomalyRecord anomaly = records.get(1);
        assertTrue(anomaly.isAnomaly());
        assertEquals("pump\\temp", anomaly.contributions().get(0).sensorName());
        assertEquals("pump", anomaly.contributions().get(0).component());
        assertEquals("temp", anomaly.contributions().get(0).tag());
        assertEquals(0.3, anomaly.contributions().get(1).fraction());
    }

    @Test
    void parsesSingleJsonArray() {
        String content = "[{\"timestamp\":\"2021-01-27T09:10:00+01:00\",\"prediction\":0},"
                + "{\"timestamp\":\"2021-01-27T09:11:00Z\",\"prediction\":0}]";

        List<AnomalyRecord> records = parser.parse(content, CONTEXT);

        assertEquals(Instant.parse("2021-01-27T08:10:00Z"), records.get(0).timestamp());
        assertEquals(2, records.size());
    }

    @Test
    void oneBadRecordRejectsTheWholeArtifact() {
        String content = "{\"timestamp\":\"2021-01-27T09:10:00Z\",\"prediction\":0}\n"
                + "{\"timestamp\":\"2021-01-27T09:11:00Z\",\"prediction\":1}\n";

        MalformedResultException ex = assertThrows(MalformedResultException.class, () -> parser.parse(content, CONTEXT));

        assertTrue(ex.getMessage().contains("Record 2"));
        assertEquals("pump/results.jsonl", ex.context().objectKey());
        assertEquals(Instant.parse("2021-01-27T09:15:00Z"), ex.context().fireTime());
    }

    @Test
    void invalidJsonIsMalformedNeverEvaluated() {
        assertThrows(MalformedResultException.class,
                () -> parser.parse("{'timestamp': datetime.now(), 'prediction': 0}", CONTEXT));
        assertThrows(MalformedResultException.class,
                () -> parser.parse("{\"timestamp\":\"2021-01-27T09:10:00Z\",\"prediction\":0} trailing", CONTEXT));
        assertThrows(MalformedResultException.class,
                () -> parser.parse("{\"timestamp\":\"2021-01-27T09:10:00Z\",\"prediction\":0,\"prediction\":1}", CONTEXT));
    }

    @Test
    void repeatedTimestampInsideOneArtifactIsMalformed() {
        String content = "{\"timestamp\":\"2021-01-27T09:10:00Z\",\"prediction\":0}\n"
                + "{\"timestamp\":\"2021-01-27T09:10:00.000\",\"prediction\":0}\n";

        assertThrows(MalformedResultException.class, () -> parser.parse(content, CONTEXT));
    }

    @Test
    void emptyArtifactHasNoRecords() {
        assertTrue(parser.parse("", CONTEXT).isEmpty());
        assertTrue(parser.parse("[]", CONTEXT).isEmpty());
    }

    @Test
    void invalidUtf8IsMalformedRatherThanReplaced() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.writeBytes(("{\"timestamp\":\"2021-01-27T09:05:00Z\",\"prediction\":1,"
                + "\"diagnostics\":[{\"name\":\"pump\\\\Sen").getBytes(StandardCharsets.UTF_8));
        bytes.write(0xFF);
        bytes.writeBytes("sor0\",\"value\":0.12}]}\n".getBytes(StandardCharsets.UTF_8));

        MalformedResultException ex = assertThrows(MalformedResultException.class,
                () -> parser.parse(new ByteArrayInputStream(bytes.toByteArray()), CONTEXT));

        assertTrue(ex.getMessage().contains("UTF-8"));
        assertEquals("pump/results.jsonl", ex.context().objectKey());
    }
}
