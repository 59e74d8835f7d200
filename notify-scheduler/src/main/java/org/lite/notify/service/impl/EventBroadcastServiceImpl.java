package org.lite.notify.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.model.ExecutionEvent;
import org.lite.notify.service.EventBroadcastService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class EventBroadcastServiceImpl implements EventBroadcastService {

    private final Map<String, Set<Listener>> listeners = new ConcurrentHashMap<>();
    private final int bufferSize;

    public EventBroadcastServiceImpl(SchedulerProperties properties) {
        this.bufferSize = properties.getEvents().getListenerBufferSize();
    }

    @Override
    public Flux<ExecutionEvent> listen(String userId) {
        Listener listener = new Listener(Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize)));
        listeners.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(listener);
        log.debug("Listener registered for user {} ({} active)", userId, listenerCount(userId));
        return listener.sink.asFlux()
                .doFinally(signal -> remove(userId, listener));
    }

    @Override
    public void publish(String userId, ExecutionEvent event) {
        Set<Listener> userListeners = listeners.get(userId);
        if (userListeners == null || userListeners.isEmpty()) {
            log.debug("No listeners for user {}, skipping {} event", userId, event.getType());
            return;
        }
        for (Listener listener : userListeners) {
            Sinks.EmitResult result = listener.emit(event);
            if (result.isFailure()) {
                log.warn("Dropping listener of user {}: emit failed with {}", userId, result.name());
                remove(userId, listener);
                listener.close();
            }
        }
    }

    @Override
    public int listenerCount(String userId) {
        Set<Listener> userListeners = listeners.get(userId);
        return userListeners == null ? 0 : userListeners.size();
    }

    private void remove(String userId, Listener listener) {
        listeners.computeIfPresent(userId, (id, set) -> {
            set.remove(listener);
            return set.isEmpty() ? null : set;
        });
    }

    private static final class Listener {
        private final Sinks.Many<ExecutionEvent> sink;

        private Listener(Sinks.Many<ExecutionEvent> sink) {
            this.sink = sink;
        }

        // Serialized so concurrent publishers never see FAIL_NON_SERIALIZED
        synchronized Sinks.EmitResult emit(ExecutionEvent event) {
            return sink.tryEmitNext(event);
        }

        synchronized void close() {
            sink.tryEmitComplete();
        }
    }
}
