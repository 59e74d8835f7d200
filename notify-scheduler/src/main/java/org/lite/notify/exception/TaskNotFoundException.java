package org.lite.notify.exception;

public class TaskNotFoundException extends NotifySchedulerException {

    public TaskNotFoundException(String taskId) {
        super(String.format("Notification task not found: %s", taskId));
    }
}
