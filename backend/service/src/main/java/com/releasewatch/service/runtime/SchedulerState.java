package com.releasewatch.service.runtime;

public enum SchedulerState {
    IDLE,
    POLLING
}
