package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.NotificationEvent;
import com.whereq.contextforge.model.NotificationEvent.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Pushes notification events to a webhook
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class WebhookNotifier implements JobNotifier {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;
    private final String webhookUrl;
    private final Set<EventType> events;

    /**
     * @param webhookUrl target URL, notifications are disabled when empty
     * @param events event types to deliver
     */
    public WebhookNotifier(WebClient.Builder webClientBuilder, String webhookUrl, Set<EventType> events) {
        this.webClientBuilder = webClientBuilder;
        this.webhookUrl = webhookUrl;
        this.events = events == null || events.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(events);
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isEmpty();
    }

    @Override
    public Mono<Void> push(String userId, NotificationEvent event) {
        if (!isEnabled() || !events.contains(event.getType())) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(userId, event))
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for {} {}: {}",
                event.getType(), describe(event), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for {} {}: {}",
                event.getType(), describe(event), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // delivery failures never affect jobs
            .then();
    }

    private Map<String, Object> buildPayload(String userId, NotificationEvent event) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("userId", userId);
        payload.put("event", event);
        payload.put("timestamp", System.currentTimeMillis());
        return payload;
    }

    private static String describe(NotificationEvent event) {
        return event.getJobId() != null ? "job " + event.getJobId() : "pipeline event";
    }
}
