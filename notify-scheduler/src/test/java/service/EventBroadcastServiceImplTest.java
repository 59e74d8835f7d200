package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.model.ExecutionEvent;
import org.lite.notify.service.impl.EventBroadcastServiceImpl;
import org.reactivestreams.Subscription;
import reactor.core.publisher.BaseSubscriber;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class EventBroadcastServiceImplTest {

    private EventBroadcastServiceImpl eventBroadcastService;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getEvents().setListenerBufferSize(2);
        eventBroadcastService = new EventBroadcastServiceImpl(properties);
    }

    private static ExecutionEvent event(String taskId) {
        return ExecutionEvent.builder()
                .type(ExecutionEvent.TASK_EXECUTED)
                .taskId(taskId)
                .title("Standup")
                .status("sent")
                .message("Sent successfully")
                .timestamp(Instant.parse("2024-01-01T10:00:00Z"))
                .build();
    }

    @Test
    void testListen_ReceivesOwnEvents() {
        StepVerifier.create(eventBroadcastService.listen("u1"))
                .then(() -> {
                    eventBroadcastService.publish("u2", event("other"));
                    eventBroadcastService.publish("u1", event("t1"));
                })
                .expectNextMatches(e -> "t1".equals(e.getTaskId()))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertEquals(0, eventBroadcastService.listenerCount("u1"));
    }

    @Test
    void testPublish_WithoutListeners() {
        assertDoesNotThrow(() -> eventBroadcastService.publish("nobody", event("t1")));
        assertEquals(0, eventBroadcastService.listenerCount("nobody"));
    }

    @Test
    void testPublish_FansOutToEveryListener() {
        // Given
        List<ExecutionEvent> first = new CopyOnWriteArrayList<>();
        List<ExecutionEvent> second = new CopyOnWriteArrayList<>();
        eventBroadcastService.listen("u1").subscribe(first::add);
        eventBroadcastService.listen("u1").subscribe(second::add);

        // When
        eventBroadcastService.publish("u1", event("t1"));

        // Then
        assertEquals(2, eventBroadcastService.listenerCount("u1"));
        assertEquals(1, first.size());
        assertEquals(1, second.size());
    }

    @Test
    void testPublish_FullListenerIsDropped() {
        // Given: one consumer keeping up, one that never requests
        List<ExecutionEvent> healthy = new CopyOnWriteArrayList<>();
        eventBroadcastService.listen("u1").subscribe(healthy::add);
        BaseSubscriber<ExecutionEvent> stalled = new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                // no demand
            }
        };
        eventBroadcastService.listen("u1").subscribe(stalled);
        assertEquals(2, eventBroadcastService.listenerCount("u1"));

        // When: one more event than the buffer holds
        eventBroadcastService.publish("u1", event("t1"));
        eventBroadcastService.publish("u1", event("t2"));
        eventBroadcastService.publish("u1", event("t3"));

        // Then
        assertEquals(3, healthy.size());
        assertEquals(1, eventBroadcastService.listenerCount("u1"));
        stalled.dispose();
    }
}
