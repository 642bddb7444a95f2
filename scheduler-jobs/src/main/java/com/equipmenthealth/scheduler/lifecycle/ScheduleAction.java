package com.equipmenthealth.scheduler.lifecycle;

public enum ScheduleAction {
    CREATE,
    START,
    STOP,
    DELETE
}
