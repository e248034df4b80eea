package com.whereq.contextforge;

import com.whereq.contextforge.dto.JobStatusResponse;
import com.whereq.contextforge.dto.JobSubmitResponse;
import com.whereq.contextforge.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "contextforge.workers.poll-interval=20ms",
        "contextforge.pipeline.batch-delay=0s"
    })
@AutoConfigureWebTestClient
class ContextForgeApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void healthReportsRunningWorkers() {
        webTestClient.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.workers.running").isEqualTo(true);
    }

    @Test
    void submittedDeduplicationJobRunsToCompletion() throws InterruptedException {
        Map<String, Object> data = Map.of(
            "threshold", 0.8,
            "items", List.of(
                Map.of("id", "a", "name", "Reviewer", "content", "Review the pull request carefully"),
                Map.of("id", "b", "name", "Reviewer copy", "content", "review the pull request   carefully"),
                Map.of("id", "c", "name", "Poet", "content", "Write a haiku about autumn")));

        JobSubmitResponse submitted = webTestClient.post().uri("/api/v1/jobs")
            .header("X-User-Id", "alice")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("type", "DEDUPLICATION", "data", data))
            .exchange()
            .expectStatus().isAccepted()
            .expectBody(JobSubmitResponse.class)
            .returnResult()
            .getResponseBody();
        assertThat(submitted).isNotNull();

        JobStatusResponse job = null;
        for (int i = 0; i < 100; i++) {
            job = webTestClient.get().uri("/api/v1/jobs/" + submitted.getJobId())
                .header("X-User-Id", "alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody(JobStatusResponse.class)
                .returnResult()
                .getResponseBody();
            if (job != null && job.getStatus() == JobStatus.COMPLETED) {
                break;
            }
            Thread.sleep(50);
        }

        assertThat(job).isNotNull();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getResult().getData().get("duplicateGroups").asInt()).isEqualTo(1);

        webTestClient.get().uri("/api/v1/jobs/" + submitted.getJobId())
            .header("X-User-Id", "bob")
            .exchange()
            .expectStatus().isForbidden();
    }
}
