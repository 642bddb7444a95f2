package com.equipmenthealth.scheduler.model;

public enum IngestionStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
