package com.equipmenthealth.scheduler.lifecycle;

public enum ScheduleState {
    UNCREATED,
    RUNNING,
    STOPPED,
    DELETED
}
