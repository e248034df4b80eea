package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.contextforge.exception.PermanentExecutionException;
import com.whereq.contextforge.exception.TransientExecutionException;
import com.whereq.contextforge.integration.EmbeddingResponse;
import com.whereq.contextforge.integration.EmbeddingService;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobStatus;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload.Algorithm;
import com.whereq.contextforge.worker.ProgressReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SimilarityScoringHandlerTest {

    @Mock
    private EmbeddingService embeddingService;

    private SimilarityScoringHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        handler = new SimilarityScoringHandler(embeddingService, new ObjectMapper());
    }

    @Test
    void syntacticScoreUsesWordOverlapOnly() throws Exception {
        Job job = job("alpha beta gamma delta", "alpha beta gamma epsilon", Algorithm.SYNTACTIC);

        JsonNode data = handler.execute(job, ProgressReporter.noop()).getData();

        assertThat(data.get("score").asDouble()).isCloseTo(0.6, within(1e-9));
        assertThat(data.get("algorithm").asText()).isEqualTo("syntactic");
        assertThat(data.get("sourceItemId").asText()).isEqualTo("source");
        assertThat(data.get("targetItemId").asText()).isEqualTo("target");
        verifyNoInteractions(embeddingService);
    }

    @Test
    void semanticScoreComparesEmbeddings() throws Exception {
        stubEmbedding("first", 1f, 0f);
        stubEmbedding("second", 0f, 1f);

        JsonNode orthogonal = handler.execute(job("first", "second", Algorithm.SEMANTIC), ProgressReporter.noop()).getData();
        JsonNode identical = handler.execute(job("first", "first", Algorithm.SEMANTIC), ProgressReporter.noop()).getData();

        assertThat(orthogonal.get("score").asDouble()).isZero();
        assertThat(identical.get("score").asDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void hybridScoreAveragesBothMeasures() throws Exception {
        stubEmbedding("same words", 1f, 0f);

        JsonNode data = handler.execute(job("same words", "same words", Algorithm.HYBRID), ProgressReporter.noop()).getData();

        assertThat(data.get("score").asDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void mismatchedEmbeddingsFailPermanently() {
        stubEmbedding("first", 1f, 0f);
        stubEmbedding("second", 1f, 0f, 0f);

        assertThatThrownBy(() -> handler.execute(job("first", "second", Algorithm.SEMANTIC), ProgressReporter.noop()))
            .isInstanceOf(PermanentExecutionException.class);
    }

    @Test
    void gatewayFailuresPropagate() {
        when(embeddingService.embed(any(), any(), any())).thenThrow(new TransientExecutionException("gateway down"));

        assertThatThrownBy(() -> handler.execute(job("a", "b", Algorithm.SEMANTIC), ProgressReporter.noop()))
            .isInstanceOf(TransientExecutionException.class);
    }

    private void stubEmbedding(String content, float... vector) {
        when(embeddingService.embed(eq("alice"), eq(content), any()))
            .thenReturn(EmbeddingResponse.builder().vector(vector).model("test-embedding").build());
    }

    private static Job job(String source, String target, Algorithm algorithm) {
        return Job.builder()
            .id("job-sim")
            .type(JobType.SIMILARITY_SCORING)
            .status(JobStatus.PROCESSING)
            .userId("alice")
            .payload(SimilarityScoringPayload.builder()
                .userId("alice")
                .sourceItemId("source")
                .targetItemId("target")
                .sourceContent(source)
                .targetContent(target)
                .algorithm(algorithm)
                .build())
            .build();
    }
}
