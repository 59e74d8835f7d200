package org.lite.notify.enums;

public enum ExecutionLogStatus {
    STARTED,        // Written before dispatch, replaced when the firing finishes
    SUCCESS,
    FAILED,
    SKIPPED         // Duplicate firing short-circuited before dispatch
}
