package org.tokbench.aggregator.model;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
}
