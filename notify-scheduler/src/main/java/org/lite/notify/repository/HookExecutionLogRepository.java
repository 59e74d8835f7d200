package org.lite.notify.repository;

import org.lite.notify.entity.HookExecutionLog;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface HookExecutionLogRepository extends ReactiveMongoRepository<HookExecutionLog, String> {

    Flux<HookExecutionLog> findByExecutionLogIdOrderByStartTimeAsc(String executionLogId);
}
