package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;
import com.equipmenthealth.scheduler.util.StringSemantics;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Definition of one inference schedule: identity, input/output locations and input file naming.
 *
 * <p>Enumerated options are validated strictly. An unknown frequency, delimiter, format or a
 * badly grained timezone offset fails with {@link InvalidConfigurationException} before any
 * remote call; nothing is replaced by a default.</p>
 */
public final class ScheduleConfig {
    public static final String SCHEDULE_NAME = "schedule_name";
    public static final String MODEL_NAME = "model_name";
    public static final String REGION = "region";
    public static final String INPUT_BUCKET = "input_bucket";
    public static final String INPUT_PREFIX = "input_prefix";
    public static final String OUTPUT_BUCKET = "output_bucket";
    public static final String OUTPUT_PREFIX = "output_prefix";
    public static final String ROLE_ARN = "role_arn";
    public static final String UPLOAD_FREQUENCY = "upload_frequency";
    public static final String DELAY_OFFSET_MINUTES = "delay_offset_minutes";
    public static final String TIMEZONE_OFFSET = "timezone_offset";
    public static final String COMPONENT_DELIMITER = "component_delimiter";
    public static final String TIMESTAMP_FORMAT = "timestamp_format";

    private static final String[] KEYS = {
            SCHEDULE_NAME, MODEL_NAME, REGION, INPUT_BUCKET, INPUT_PREFIX, OUTPUT_BUCKET, OUTPUT_PREFIX,
            ROLE_ARN, UPLOAD_FREQUENCY, DELAY_OFFSET_MINUTES, TIMEZONE_OFFSET, COMPONENT_DELIMITER, TIMESTAMP_FORMAT
    };
    private static final String ENV_PREFIX = "SCHEDULER_";

    public final String scheduleName;
    public final String modelName;
    public final String region;
    public final String inputBucket;
    public final String inputPrefix;
    public final String outputBucket;
    public final String outputPrefix;
    public final String roleArn;
    public final UploadFrequency uploadFrequency;
    public final int delayOffsetMinutes;
    public final TimezoneOffset timezoneOffset;
    public final ComponentDelimiter componentDelimiter;
    public final TimestampFormat timestampFormat;

    private ScheduleConfig(
            String scheduleName,
            String modelName,
            String region,
            String inputBucket,
            String inputPrefix,
            String outputBucket,
            String outputPrefix,
            String roleArn,
            UploadFrequency uploadFrequency,
            int delayOffsetMinutes,
            TimezoneOffset timezoneOffset,
            ComponentDelimiter componentDelimiter,
            TimestampFormat timestampFormat) {
        this.scheduleName = scheduleName;
        this.modelName = modelName;
        this.region = region;
        this.inputBucket = inputBucket;
        this.inputPrefix = inputPrefix;
        this.outputBucket = outputBucket;
        this.outputPrefix = outputPrefix;
        this.roleArn = roleArn;
        this.uploadFrequency = uploadFrequency;
        this.delayOffsetMinutes = delayOffsetMinutes;
        this.timezoneOffset = timezoneOffset;
        this.componentDelimiter = componentDelimiter;
        this.timestampFormat = timestampFormat;
    }

    /**
     * Reads every option from {@code SCHEDULER_<OPTION>} environment variables, e.g.
     * {@code SCHEDULER_UPLOAD_FREQUENCY=PT5M}.
     */
    public static ScheduleConfig fromEnv() {
        Map<String, String> values = new HashMap<>();
        for (String key : KEYS) {
            String value = System.getenv(ENV_PREFIX + key.toUpperCase(Locale.ROOT));
            if (value != null) {
                values.put(key, value);
            }
        }
        return fromMap(values);
    }

    public static ScheduleConfig fromMap(Map<String, String> values) {
        String scheduleName = require(values, SCHEDULE_NAME);
        String modelName = require(values, MODEL_NAME);
        String region = optional(values, REGION, "us-east-1");
        String inputBucket = require(values, INPUT_BUCKET);
        String inputPrefix = optional(values, INPUT_PREFIX, "");
        String outputBucket = require(values, OUTPUT_BUCKET);
        String outputPrefix = optional(values, OUTPUT_PREFIX, "");
        String roleArn = require(values, ROLE_ARN);

        UploadFrequency uploadFrequency = UploadFrequency.parse(values.get(UPLOAD_FREQUENCY));
        int delayOffsetMinutes = parseDelay(values.get(DELAY_OFFSET_MINUTES));
        TimezoneOffset timezoneOffset = TimezoneOffset.parse(optional(values, TIMEZONE_OFFSET, "+00:00"));
        ComponentDelimiter componentDelimiter = ComponentDelimiter.parse(values.get(COMPONENT_DELIMITER));
        TimestampFormat timestampFormat = TimestampFormat.parse(values.get(TIMESTAMP_FORMAT));

        return new ScheduleConfig(
                scheduleName,
                modelName,
                region,
                inputBucket,
                inputPrefix,
                outputBucket,
                outputPrefix,
                roleArn,
                uploadFrequency,
                delayOffsetMinutes,
                timezoneOffset,
                componentDelimiter,
                timestampFormat);
    }

    public Map<String, String> toMap() {
        Map<String, String> map = new HashMap<>();
        map.put(SCHEDULE_NAME, scheduleName);
        map.put(MODEL_NAME, modelName);
        map.put(REGION, region);
        map.put(INPUT_BUCKET, inputBucket);
        map.put(INPUT_PREFIX, inputPrefix);
        map.put(OUTPUT_BUCKET, outputBucket);
        map.put(OUTPUT_PREFIX, outputPrefix);
        map.put(ROLE_ARN, roleArn);
        map.put(UPLOAD_FREQUENCY, uploadFrequency.name());
        map.put(DELAY_OFFSET_MINUTES, Integer.toString(delayOffsetMinutes));
        map.put(TIMEZONE_OFFSET, timezoneOffset.toString());
        map.put(COMPONENT_DELIMITER, componentDelimiter.symbol());
        map.put(TIMESTAMP_FORMAT, timestampFormat.label());
        return map;
    }

    private static String require(Map<String, String> values, String key) {
        String value = values.get(key);
        if (StringSemantics.isBlank(value)) {
            throw new InvalidConfigurationException("Missing required option " + key, ErrorContext.NONE);
        }
        return value.trim();
    }

    private static String optional(Map<String, String> values, String key, String defaultValue) {
        String value = values.get(key);
        return StringSemantics.isBlank(value) ? defaultValue : value.trim();
    }

    private static int parseDelay(String raw) {
        if (StringSemantics.isBlank(raw)) {
            return 0;
        }
        int delay;
        try {
            delay = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException(
                    DELAY_OFFSET_MINUTES + " must be an integer but was " + raw, ErrorContext.NONE, ex);
        }
        if (delay < 0) {
            throw new InvalidConfigurationException(
                    DELAY_OFFSET_MINUTES + " must be >= 0 but was " + delay, ErrorContext.NONE);
        }
        return delay;
    }
}
