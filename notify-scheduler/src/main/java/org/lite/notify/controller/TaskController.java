package org.lite.notify.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.entity.ExecutionLog;
import org.lite.notify.entity.HookExecutionLog;
import org.lite.notify.entity.NotificationTask;
import org.lite.notify.enums.TaskStatus;
import org.lite.notify.service.ExecutionLogService;
import org.lite.notify.service.TaskLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Task creation, status transitions and execution history of stored tasks.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
@Slf4j
public class TaskController {

    private final TaskLifecycleService taskLifecycleService;
    private final ExecutionLogService executionLogService;

    @PostMapping
    public Mono<ResponseEntity<NotificationTask>> create(@RequestHeader("X-User-Id") String userId,
                                                         @RequestBody NotificationTask task) {
        log.info("Creating task '{}' for user {}", task.getTitle(), userId);
        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(taskLifecycleService.create(userId, task)));
    }

    @GetMapping
    public Mono<List<NotificationTask>> list(@RequestHeader("X-User-Id") String userId,
                                             @RequestParam(required = false) TaskStatus status) {
        return blocking(() -> taskLifecycleService.list(userId, status));
    }

    @GetMapping("/{taskId}")
    public Mono<NotificationTask> get(@PathVariable String taskId) {
        return blocking(() -> taskLifecycleService.get(taskId));
    }

    @PostMapping("/{taskId}/cancel")
    public Mono<NotificationTask> cancel(@PathVariable String taskId) {
        log.info("Cancelling task {}", taskId);
        return blocking(() -> taskLifecycleService.cancel(taskId));
    }

    @PostMapping("/{taskId}/pause")
    public Mono<NotificationTask> pause(@PathVariable String taskId) {
        log.info("Pausing task {}", taskId);
        return blocking(() -> taskLifecycleService.pause(taskId));
    }

    @PostMapping("/{taskId}/resume")
    public Mono<NotificationTask> resume(@PathVariable String taskId) {
        log.info("Resuming task {}", taskId);
        return blocking(() -> taskLifecycleService.resume(taskId));
    }

    @PutMapping("/{taskId}")
    public Mono<NotificationTask> rearm(@PathVariable String taskId, @RequestBody NotificationTask task) {
        log.info("Re-arming task {}", taskId);
        return blocking(() -> taskLifecycleService.rearm(taskId, task));
    }

    @DeleteMapping("/{taskId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String taskId) {
        log.info("Deleting task {}", taskId);
        return blocking(() -> {
            taskLifecycleService.delete(taskId);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @GetMapping("/{taskId}/executions")
    public Mono<List<ExecutionLog>> getExecutions(@PathVariable String taskId,
                                                  @RequestParam(defaultValue = "20") int limit) {
        return blocking(() -> executionLogService.findRecent(taskId, limit));
    }

    @GetMapping("/executions/{executionLogId}/hooks")
    public Mono<List<HookExecutionLog>> getHookLogs(@PathVariable String executionLogId) {
        return blocking(() -> executionLogService.findHookLogs(executionLogId));
    }

    // Store access blocks, keep it off the event loop
    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
