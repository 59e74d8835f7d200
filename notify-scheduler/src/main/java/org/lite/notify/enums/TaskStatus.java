package org.lite.notify.enums;

public enum TaskStatus {
    PENDING,        // Waiting for its next firing
    SENT,           // One-time task delivered to at least one channel
    FAILED,         // Last firing failed
    CANCELLED,      // Cancelled by the user, kept in the store
    PAUSED          // Suppressed until resumed
}
