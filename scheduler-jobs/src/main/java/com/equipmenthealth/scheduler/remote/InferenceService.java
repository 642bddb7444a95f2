package com.equipmenthealth.scheduler.remote;

import com.equipmenthealth.scheduler.config.ScheduleConfig;
import com.equipmenthealth.scheduler.model.IngestionJob;
import com.equipmenthealth.scheduler.model.ObjectRef;

/**
 * Operations of the remote anomaly-detection service used by the scheduler.
 *
 * <p>Implementations translate transport problems into
 * {@link com.equipmenthealth.scheduler.error.TransportFailureException}. Remote-side precondition
 * failures map to the matching exception of the scheduler taxonomy: a schedule that already exists
 * to {@code AlreadyExistsException}, a call overlapping another lifecycle call or hitting the wrong
 * state to {@code InvalidStateException}, and an upload frequency incompatible with the model's
 * sampling cadence to {@code InvalidConfigurationException}.</p>
 */
public interface InferenceService {

    /**
     * Creates the schedule and starts it; returns the remote status string.
     */
    String createSchedule(String scheduleName, String modelName, ScheduleConfig config);

    void startSchedule(String scheduleName);

    void stopSchedule(String scheduleName);

    void deleteSchedule(String scheduleName);

    ExecutionPage listExecutions(ListExecutionsRequest request);

    IngestionJob startIngestionJob(String datasetName, String roleArn, ObjectRef source);

    IngestionJob describeIngestionJob(String jobId);
}
