package com.equipmenthealth.scheduler.lifecycle;

import com.equipmenthealth.scheduler.config.ScheduleConfig;
import com.equipmenthealth.scheduler.remote.InferenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the configuration and state of one named remote schedule.
 *
 * <p>Transitions are serialized by a lock and applied locally only after the remote call returns.
 * When the remote call throws, local state is left as it was and the exception propagates.</p>
 */
public class ScheduleLifecycleController {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleLifecycleController.class);

    private final ScheduleConfig config;
    private final InferenceService service;
    private final ModelRegistry registry;
    private final Clock clock;
    private final ReentrantLock transitionLock = new ReentrantLock();

    private volatile ScheduleState state = ScheduleState.UNCREATED;
    private volatile String remoteStatus;
    private volatile Instant lastTransitionAt;

    public ScheduleLifecycleController(ScheduleConfig config, InferenceService service, ModelRegistry registry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.service = Objects.requireNonNull(service, "service");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String scheduleName() {
        return config.scheduleName;
    }

    public ScheduleConfig config() {
        return config;
    }

    public ScheduleState state() {
        return state;
    }

    public ScheduleSnapshot describe() {
        transitionLock.lock();
        try {
            return new ScheduleSnapshot(
                    config.scheduleName, config.modelName, state, remoteStatus, lastTransitionAt, config);
        } finally {
            transitionLock.unlock();
        }
    }

    public ScheduleState create() {
        transitionLock.lock();
        try {
            ScheduleState next = ScheduleStateMachine.next(state, ScheduleAction.CREATE, config.scheduleName);
            registry.claim(config.modelName, config.scheduleName);
            String status;
            try {
                status = service.createSchedule(config.scheduleName, config.modelName, config);
            } catch (RuntimeException ex) {
                registry.release(config.modelName, config.scheduleName);
                LOG.warn("Create failed for schedule {} (model={}): {}", config.scheduleName, config.modelName, ex.getMessage());
                throw ex;
            }
            remoteStatus = status;
            return apply(ScheduleAction.CREATE, next);
        } finally {
            transitionLock.unlock();
        }
    }

    public ScheduleState stop() {
        return transition(ScheduleAction.STOP);
    }

    public ScheduleState start() {
        return transition(ScheduleAction.START);
    }

    public ScheduleState delete() {
        transitionLock.lock();
        try {
            ScheduleState next = transition(ScheduleAction.DELETE);
            registry.release(config.modelName, config.scheduleName);
            return next;
        } finally {
            transitionLock.unlock();
        }
    }

    private ScheduleState transition(ScheduleAction action) {
        transitionLock.lock();
        try {
            ScheduleState next = ScheduleStateMachine.next(state, action, config.scheduleName);
            try {
                switch (action) {
                    case STOP:
                        service.stopSchedule(config.scheduleName);
                        break;
                    case START:
                        service.startSchedule(config.scheduleName);
                        break;
                    case DELETE:
                        service.deleteSchedule(config.scheduleName);
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported action " + action);
                }
            } catch (RuntimeException ex) {
                LOG.warn("{} failed for schedule {} in state {}: {}", action, config.scheduleName, state, ex.getMessage());
                throw ex;
            }
            remoteStatus = next.name();
            return apply(action, next);
        } finally {
            transitionLock.unlock();
        }
    }

    private ScheduleState apply(ScheduleAction action, ScheduleState next) {
        ScheduleState previous = state;
        state = next;
        lastTransitionAt = clock.instant();
        LOG.info("Schedule {} {}: {} -> {}", config.scheduleName, action, previous, next);
        return next;
    }
}
