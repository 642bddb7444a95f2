package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleConfigTest {

    static Map<String, String> validOptions() {
        Map<String, String> values = new HashMap<>();
        values.put(ScheduleConfig.SCHEDULE_NAME, "pump-scheduler");
        values.put(ScheduleConfig.MODEL_NAME, "pump-model");
        values.put(ScheduleConfig.INPUT_BUCKET, "equipment-input");
        values.put(ScheduleConfig.INPUT_PREFIX, "inference-data/input/");
        values.put(ScheduleConfig.OUTPUT_BUCKET, "equipment-output");
        values.put(ScheduleConfig.OUTPUT_PREFIX, "inference-data/output/");
        values.put(ScheduleConfig.ROLE_ARN, "arn:aws:iam::123456789012:role/scheduler");
        values.put(ScheduleConfig.UPLOAD_FREQUENCY, "PT5M");
        values.put(ScheduleConfig.DELAY_OFFSET_MINUTES, "2");
        values.put(ScheduleConfig.TIMEZONE_OFFSET, "+05:30");
        values.put(ScheduleConfig.COMPONENT_DELIMITER, "_");
        values.put(ScheduleConfig.TIMESTAMP_FORMAT, "yyyyMMddHHmmss");
        return values;
    }

    @Test
    void parsesEveryOption() {
        ScheduleConfig config = ScheduleConfig.fromMap(validOptions());

        assertEquals("pump-scheduler", config.scheduleName);
        assertEquals("pump-model", config.modelName);
        assertEquals("us-east-1", config.region);
        assertEquals(UploadFrequency.PT5M, config.uploadFrequency);
        assertEquals(2, config.delayOffsetMinutes);
        assertEquals(Duration.ofMinutes(330).getSeconds(), config.timezoneOffset.zoneOffset().getTotalSeconds());
        assertEquals(ComponentDelimiter.UNDERSCORE, config.componentDelimiter);
        assertEquals(TimestampFormat.COMPACT, config.timestampFormat);
    }

    @Test
    void toMapRoundTripsThroughFromMap() {
        ScheduleConfig config = ScheduleConfig.fromMap(validOptions());
        ScheduleConfig again = ScheduleConfig.fromMap(config.toMap());

        assertEquals(config.toMap(), again.toMap());
    }

    @Test
    void missingRequiredOptionIsRejected() {
        Map<String, String> values = validOptions();
        values.remove(ScheduleConfig.ROLE_ARN);

        InvalidConfigurationException ex = assertThrows(
                InvalidConfigurationException.class, () -> ScheduleConfig.fromMap(values));
        assertTrue(ex.getMessage().contains("role_arn"));
    }

    @Test
    void unsupportedFrequencyIsNeverDefaulted() {
        Map<String, String> values = validOptions();
        values.put(ScheduleConfig.UPLOAD_FREQUENCY, "PT7M");

        assertThrows(InvalidConfigurationException.class, () -> ScheduleConfig.fromMap(values));
    }

    @Test
    void negativeOrNonNumericDelayIsRejected() {
        Map<String, String> negative = validOptions();
        negative.put(ScheduleConfig.DELAY_OFFSET_MINUTES, "-1");
        Map<String, String> text = validOptions();
        text.put(ScheduleConfig.DELAY_OFFSET_MINUTES, "soon");

        assertThrows(InvalidConfigurationException.class, () -> ScheduleConfig.fromMap(negative));
        assertThrows(InvalidConfigurationException.class, () -> ScheduleConfig.fromMap(text));
    }

    @Test
    void absentDelayAndTimezoneUseNeutralValues() {
        Map<String, String> values = validOptions();
        values.remove(ScheduleConfig.DELAY_OFFSET_MINUTES);
        values.remove(ScheduleConfig.TIMEZONE_OFFSET);

        ScheduleConfig config = ScheduleConfig.fromMap(values);

        assertEquals(0, config.delayOffsetMinutes);
        assertEquals(TimezoneOffset.UTC, config.timezoneOffset);
    }

    @Test
    void invalidFailureClassIsStable() {
        Map<String, String> values = validOptions();
        values.put(ScheduleConfig.COMPONENT_DELIMITER, "|");

        InvalidConfigurationException ex = assertThrows(
                InvalidConfigurationException.class, () -> ScheduleConfig.fromMap(values));
        assertEquals("INVALID_CONFIGURATION", ex.failureClass());
    }
}
