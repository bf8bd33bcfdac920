package com.github.dimitryivaniuta.governance.scheduler;

public enum JobOutcome {
    SUCCEEDED,
    FAILED
}
