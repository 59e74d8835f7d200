package org.lite.notify.service.impl;

import lombok.RequiredArgsConstructor;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.repository.NotificationTaskRepository;
import org.lite.notify.service.TaskStoreService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class TaskStoreServiceImpl implements TaskStoreService {

    private final NotificationTaskRepository notificationTaskRepository;

    @Override
    public Optional<NotificationTask> findById(String taskId) {
        return notificationTaskRepository.findById(taskId).blockOptional();
    }

    @Override
    public NotificationTask save(NotificationTask task) {
        return notificationTaskRepository.save(task).block();
    }

    @Override
    public List<NotificationTask> findByStatus(TaskStatus status) {
        return notificationTaskRepository.findByStatus(status).collectList().block();
    }

    @Override
    public List<NotificationTask> findByUserId(String userId) {
        return notificationTaskRepository.findByUserId(userId).collectList().block();
    }

    @Override
    public void deleteById(String taskId) {
        notificationTaskRepository.deleteById(taskId).block();
    }
}
