package org.lite.notify.repository;

import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.enums.ExecutionLogStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;

@Repository
public interface ExecutionLogRepository extends ReactiveMongoRepository<ExecutionLog, String> {

    // Duplicate-window check
    Flux<ExecutionLog> findByTaskIdAndStatusInAndStartTimeAfter(String taskId, Collection<ExecutionLogStatus> statuses, Instant after);

    // Alert windows
    Mono<Long> countByTaskIdAndDuplicateTrueAndStartTimeAfter(String taskId, Instant after);

    Mono<Long> countByTaskIdAndStatusAndStartTimeAfter(String taskId, ExecutionLogStatus status, Instant after);

    Mono<Long> countByTaskIdAndStatusInAndStartTimeAfter(String taskId, Collection<ExecutionLogStatus> statuses, Instant after);

    Mono<Long> countByTaskIdAndDurationMsGreaterThanAndStartTimeAfter(String taskId, Long durationMs, Instant after);

    // History
    Flux<ExecutionLog> findByTaskIdOrderByStartTimeDesc(String taskId, Pageable pageable);
}
