package com.github.dimitryivaniuta.governance.scheduler;

public enum JobState {
    IDLE,
    RUNNING
}
