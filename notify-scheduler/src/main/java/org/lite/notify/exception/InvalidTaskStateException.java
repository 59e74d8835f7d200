package org.lite.notify.exception;

import org.lite.notify.enums.TaskStatus;

/**
 * Exception thrown when a lifecycle operation is not allowed from the task's current status
 */
public class InvalidTaskStateException extends NotifySchedulerException {

    public InvalidTaskStateException(String taskId, TaskStatus current, String operation) {
        super(String.format("Cannot %s task %s in status %s", operation, taskId, current));
    }
}
