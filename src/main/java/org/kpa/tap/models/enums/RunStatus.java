package org.kpa.tap.models.enums;

public enum RunStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED
}
