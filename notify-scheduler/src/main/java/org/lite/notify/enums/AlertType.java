package org.lite.notify.enums;

public enum AlertType {
    DUPLICATE_EXECUTION,    // Duplicate firings skipped inside the window
    EXECUTION_FAILURE,      // Failed firings inside the window
    LONG_RUNNING,           // Firings slower than max_duration_seconds
    HIGH_FAILURE_RATE       // Failure percentage over failure_rate_percent
}
