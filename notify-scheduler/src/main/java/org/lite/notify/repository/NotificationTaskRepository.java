package org.lite.notify.repository;

import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface NotificationTaskRepository extends ReactiveMongoRepository<NotificationTask, String> {

    Flux<NotificationTask> findByStatus(TaskStatus status);

    Flux<NotificationTask> findByUserId(String userId);
}
