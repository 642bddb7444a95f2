package com.equipmenthealth.scheduler.lifecycle;

import com.equipmenthealth.scheduler.config.ScheduleConfig;

import java.time.Instant;

/**
 * Point-in-time view of a schedule held by its controller.
 */
public final class ScheduleSnapshot {
    public final String scheduleName;
    public final String modelName;
    public final ScheduleState state;
    public final String remoteStatus;
    public final Instant lastTransitionAt;
    public final ScheduleConfig config;

    ScheduleSnapshot(
            String scheduleName,
            String modelName,
            ScheduleState state,
            String remoteStatus,
            Instant lastTransitionAt,
            ScheduleConfig config) {
        this.scheduleName = scheduleName;
        this.modelName = modelName;
        this.state = state;
        this.remoteStatus = remoteStatus;
        this.lastTransitionAt = lastTransitionAt;
        this.config = config;
    }

    @Override
    public String toString() {
        return "ScheduleSnapshot{schedule=" + scheduleName + ", model=" + modelName + ", state=" + state
                + ", remoteStatus=" + remoteStatus + ", lastTransitionAt=" + lastTransitionAt + "}";
    }
}
