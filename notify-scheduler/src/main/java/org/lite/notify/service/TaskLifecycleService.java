package org.lite.notify.service;

import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.exception.InvalidExpressionException;
import org.lite.notify.exception.InvalidTaskStateException;
import org.lite.notify.exception.TaskNotFoundException;

import java.util.List;

/**
 * User-driven task operations. Each keeps the stored status and the live
 * Quartz registration in step, and none of them overwrites a firing's
 * outcome saved in the meantime.
 *
 * @throws TaskNotFoundException for unknown ids
 * @throws InvalidTaskStateException for transitions the current status does not allow
 */
public interface TaskLifecycleService {

    /**
     * Store a new task as pending and register it.
     * @throws InvalidExpressionException if a recurring task's cron expression is not valid
     * @throws IllegalArgumentException if required fields are missing
     */
    NotificationTask create(String userId, NotificationTask task);

    NotificationTask get(String taskId);

    /**
     * Tasks of one user, newest first.
     * @param status optional filter, null for every status
     */
    List<NotificationTask> list(String userId, TaskStatus status);

    NotificationTask cancel(String taskId);

    NotificationTask pause(String taskId);

    NotificationTask resume(String taskId);

    /**
     * Apply the editable fields of {@code edits} to the stored task, set it
     * pending and register it again. Timing (recurring flag, cron expression,
     * scheduled time) is always taken from {@code edits}; title, content,
     * delivery and hooks only when present. Owner, audit fields and delivery
     * results are kept.
     * @throws InvalidExpressionException if a recurring task's cron expression is not valid
     * @throws IllegalArgumentException if a one-time task has no scheduled time
     */
    NotificationTask rearm(String taskId, NotificationTask edits);

    void delete(String taskId);
}
