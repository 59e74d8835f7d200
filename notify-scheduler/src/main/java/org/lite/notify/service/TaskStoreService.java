package org.lite.notify.service;

import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.springframework.dao.OptimisticLockingFailureException;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Blocking access to task records, for use from scheduler worker threads.
 */
public interface TaskStoreService {

    int MAX_UPDATE_ATTEMPTS = 5;

    Optional<NotificationTask> findById(String taskId);

    /**
     * @throws OptimisticLockingFailureException if the task was saved by someone
     *         else since it was read
     */
    NotificationTask save(NotificationTask task);

    List<NotificationTask> findByStatus(TaskStatus status);

    List<NotificationTask> findByUserId(String userId);

    void deleteById(String taskId);

    /**
     * Read-modify-write of one task. When another writer saved the task in
     * between, the change is applied again to a fresh read, so neither write
     * is lost. Exceptions thrown by {@code change} propagate unchanged.
     *
     * @return the saved task, or empty if the task does not exist
     * @throws OptimisticLockingFailureException if every attempt lost the race
     */
    default Optional<NotificationTask> update(String taskId, UnaryOperator<NotificationTask> change) {
        OptimisticLockingFailureException conflict = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Optional<NotificationTask> current = findById(taskId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(save(change.apply(current.get())));
            } catch (OptimisticLockingFailureException e) {
                conflict = e;
            }
        }
        throw conflict;
    }
}
