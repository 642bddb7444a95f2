package com.equipmenthealth.scheduler.config;

import java.time.Duration;
import java.util.Map;

/**
 * Polling and aggregation tuning knobs, sourced from environment variables.
 *
 * <p>These are policy values, not correctness inputs: unparsable or non-positive values fall back to defaults.</p>
 */
public class SchedulerRuntimeConfig {
    public final Duration executionPollInterval;
    public final Duration executionMaxWait;
    public final Duration ingestionPollInterval;
    public final Duration ingestionMaxWait;
    public final int listPageSize;
    public final int aggregationParallelism;

    public SchedulerRuntimeConfig(
            Duration executionPollInterval,
            Duration executionMaxWait,
            Duration ingestionPollInterval,
            Duration ingestionMaxWait,
            int listPageSize,
            int aggregationParallelism) {
        this.executionPollInterval = executionPollInterval;
        this.executionMaxWait = executionMaxWait;
        this.ingestionPollInterval = ingestionPollInterval;
        this.ingestionMaxWait = ingestionMaxWait;
        this.listPageSize = Math.max(1, listPageSize);
        this.aggregationParallelism = Math.max(1, aggregationParallelism);
    }

    public static SchedulerRuntimeConfig fromEnv() {
        return fromMap(System.getenv());
    }

    public static SchedulerRuntimeConfig fromMap(Map<String, String> env) {
        Duration executionPollInterval = Duration.ofSeconds(positiveLong(env, "SCHEDULER_EXECUTION_POLL_INTERVAL_SEC", 60L));
        Duration executionMaxWait = Duration.ofMinutes(positiveLong(env, "SCHEDULER_EXECUTION_MAX_WAIT_MIN", 30L));
        Duration ingestionPollInterval = Duration.ofSeconds(positiveLong(env, "SCHEDULER_INGESTION_POLL_INTERVAL_SEC", 60L));
        Duration ingestionMaxWait = Duration.ofMinutes(positiveLong(env, "SCHEDULER_INGESTION_MAX_WAIT_MIN", 360L));
        int listPageSize = (int) positiveLong(env, "SCHEDULER_LIST_PAGE_SIZE", 50L);
        int aggregationParallelism = (int) positiveLong(env, "SCHEDULER_AGGREGATION_PARALLELISM", 4L);

        return new SchedulerRuntimeConfig(
                executionPollInterval,
                executionMaxWait,
                ingestionPollInterval,
                ingestionMaxWait,
                listPageSize,
                aggregationParallelism);
    }

    private static long positiveLong(Map<String, String> env, String key, long defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed > 0 && parsed <= Integer.MAX_VALUE ? parsed : defaultValue;
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }
}
