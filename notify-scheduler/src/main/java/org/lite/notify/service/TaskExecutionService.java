package org.lite.notify.service;

public interface TaskExecutionService {

    /**
     * Run one firing of the task under its single-flight lock: duplicate
     * check, hooks, dispatch, roll-forward, logging, events and alerts.
     * Never throws.
     */
    void execute(String taskId);
}
