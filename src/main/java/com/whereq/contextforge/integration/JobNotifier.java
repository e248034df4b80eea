package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.NotificationEvent;
import reactor.core.publisher.Mono;

/**
 * Pushes job and pipeline events to clients.
 * Implementations must not fail the returned Mono for delivery errors.
 */
public interface JobNotifier {

    Mono<Void> push(String userId, NotificationEvent event);

    static JobNotifier noop() {
        return (userId, event) -> Mono.empty();
    }
}
