package com.equipmenthealth.scheduler.model;

public enum ExecutionStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
