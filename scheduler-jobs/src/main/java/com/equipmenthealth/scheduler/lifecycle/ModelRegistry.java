package com.equipmenthealth.scheduler.lifecycle;

import com.equipmenthealth.scheduler.error.AlreadyExistsException;
import com.equipmenthealth.scheduler.error.ErrorContext;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local claim of "one schedule per model", checked before any remote call.
 * The remote service remains the authority; this only rejects conflicts it can see early.
 */
public final class ModelRegistry {
    private final ConcurrentMap<String, String> scheduleByModel = new ConcurrentHashMap<>();

    public void claim(String modelName, String scheduleName) {
        String holder = scheduleByModel.putIfAbsent(modelName, scheduleName);
        if (holder != null) {
            throw new AlreadyExistsException(
                    "Model " + modelName + " already has schedule " + holder, ErrorContext.schedule(scheduleName));
        }
    }

    public void release(String modelName, String scheduleName) {
        scheduleByModel.remove(modelName, scheduleName);
    }

    public Optional<String> scheduleFor(String modelName) {
        return Optional.ofNullable(scheduleByModel.get(modelName));
    }
}
