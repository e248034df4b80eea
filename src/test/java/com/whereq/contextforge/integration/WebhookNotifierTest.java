package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.NotificationEvent;
import com.whereq.contextforge.model.NotificationEvent.EventType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookNotifierTest {

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void deliversSubscribedEvents() {
        WebhookNotifier notifier = notifier("http://hooks.test/jobs", HttpStatus.OK);

        StepVerifier.create(notifier.push("alice", completed())).verifyComplete();

        assertThat(requests).singleElement()
            .satisfies(request -> assertThat(request.url().toString()).isEqualTo("http://hooks.test/jobs"));
    }

    @Test
    void skipsEventsThatAreNotSubscribed() {
        WebhookNotifier notifier = notifier("http://hooks.test/jobs", HttpStatus.OK);

        StepVerifier.create(notifier.push("alice", NotificationEvent.pipeline(EventType.PIPELINE_STARTED, "started")))
            .verifyComplete();

        assertThat(requests).isEmpty();
    }

    @Test
    void isDisabledWithoutUrl() {
        WebhookNotifier notifier = notifier("", HttpStatus.OK);

        assertThat(notifier.isEnabled()).isFalse();
        StepVerifier.create(notifier.push("alice", completed())).verifyComplete();
        assertThat(requests).isEmpty();
    }

    @Test
    void deliveryFailuresDoNotPropagate() {
        WebhookNotifier notifier = notifier("http://hooks.test/jobs", HttpStatus.INTERNAL_SERVER_ERROR);

        StepVerifier.create(notifier.push("alice", completed())).verifyComplete();

        assertThat(requests).hasSize(1);
    }

    private WebhookNotifier notifier(String url, HttpStatus status) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status).build());
        });
        return new WebhookNotifier(builder, url, Set.of(EventType.JOB_COMPLETED, EventType.JOB_FAILED));
    }

    private static NotificationEvent completed() {
        return NotificationEvent.builder()
            .type(EventType.JOB_COMPLETED)
            .jobId("job-1")
            .jobType(JobType.OPTIMIZATION)
            .status(JobStatus.COMPLETED)
            .progress(100)
            .build();
    }
}
