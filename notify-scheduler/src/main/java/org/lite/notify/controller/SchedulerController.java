package org.lite.notify.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.notify.dto.ChannelInfo;
import org.lite.notify.enums.ChannelType;
import org.lite.notify.model.ExecutionEvent;
import org.lite.notify.model.ScheduledJobInfo;
import org.lite.notify.service.EventBroadcastService;
import org.lite.notify.service.TaskSchedulingService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SchedulerController {

    private final TaskSchedulingService taskSchedulingService;
    private final EventBroadcastService eventBroadcastService;

    @GetMapping("/scheduler/jobs")
    public Mono<Map<String, List<ScheduledJobInfo>>> getScheduledJobs() {
        return Mono.fromCallable(() -> Map.of("jobs", taskSchedulingService.getScheduledJobs()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/channels")
    public Flux<ChannelInfo> getChannels() {
        return Flux.fromStream(Arrays.stream(ChannelType.values()).map(ChannelInfo::of));
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(() -> {
                    boolean running = taskSchedulingService.isRunning();
                    Map<String, Object> health = new LinkedHashMap<>();
                    health.put("status", running ? "UP" : "DOWN");
                    health.put("schedulerRunning", running);
                    health.put("registeredJobs", taskSchedulingService.getScheduledJobs().size());
                    return health;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Live execution events of the calling user. The user id is set by the
     * upstream gateway after authentication.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ExecutionEvent>> events(@RequestHeader("X-User-Id") String userId) {
        log.info("Opening event stream for user {}", userId);
        return eventBroadcastService.listen(userId)
                .map(event -> ServerSentEvent.builder(event).event(event.getType()).build());
    }
}
