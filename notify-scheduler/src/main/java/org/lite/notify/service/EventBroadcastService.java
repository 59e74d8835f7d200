package org.lite.notify.service;

import org.lite.notify.model.ExecutionEvent;
import reactor.core.publisher.Flux;

public interface EventBroadcastService {

    /**
     * Live stream of the user's events. Cancelling the subscription removes
     * the listener.
     */
    Flux<ExecutionEvent> listen(String userId);

    /**
     * Never blocks. A listener whose buffer is full is dropped.
     */
    void publish(String userId, ExecutionEvent event);

    int listenerCount(String userId);
}
