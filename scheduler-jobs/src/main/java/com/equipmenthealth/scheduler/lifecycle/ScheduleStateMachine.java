package com.equipmenthealth.scheduler.lifecycle;

import com.equipmenthealth.scheduler.error.AlreadyExistsException;
import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidStateException;

/**
 * Deterministic transition table for a remote schedule.
 *
 * <pre>
 * UNCREATED --create--> RUNNING
 * RUNNING   --stop----> STOPPED
 * STOPPED   --start---> RUNNING
 * STOPPED   --delete--> DELETED
 * </pre>
 *
 * <p>There is no idle "created" state: the remote side starts executing on creation. A create on
 * a live schedule is {@code AlreadyExists}; every other edge not listed is {@code InvalidState}.
 * DELETED is terminal.</p>
 */
public final class ScheduleStateMachine {
    private ScheduleStateMachine() {}

    public static ScheduleState next(ScheduleState current, ScheduleAction action, String scheduleName) {
        ErrorContext ctx = ErrorContext.schedule(scheduleName);
        switch (action) {
            case CREATE:
                if (current == ScheduleState.UNCREATED) {
                    return ScheduleState.RUNNING;
                }
                if (current == ScheduleState.RUNNING || current == ScheduleState.STOPPED) {
                    throw new AlreadyExistsException("Schedule already exists in state " + current, ctx);
                }
                throw new InvalidStateException("Cannot create a deleted schedule again", ctx);
            case STOP:
                if (current == ScheduleState.RUNNING) {
                    return ScheduleState.STOPPED;
                }
                throw new InvalidStateException("Cannot stop a schedule in state " + current, ctx);
            case START:
                if (current == ScheduleState.STOPPED) {
                    return ScheduleState.RUNNING;
                }
                throw new InvalidStateException("Cannot start a schedule in state " + current, ctx);
            case DELETE:
                if (current == ScheduleState.STOPPED) {
                    return ScheduleState.DELETED;
                }
                if (current == ScheduleState.RUNNING) {
                    throw new InvalidStateException("Schedule is running; stop it before deleting", ctx);
                }
                throw new InvalidStateException("Cannot delete a schedule in state " + current, ctx);
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }
}
