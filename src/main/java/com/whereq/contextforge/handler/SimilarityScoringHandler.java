package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.exception.PermanentExecutionException;
import com.whereq.contextforge.integration.EmbeddingService;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload;
import com.whereq.contextforge.model.payload.SimilarityScoringPayload.Algorithm;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;

/**
 * Scores how similar two items are.
 * Syntactic compares word sets, semantic compares embeddings and hybrid averages both.
 *
 * @author WhereQ Inc.
 */
public class SimilarityScoringHandler extends AbstractJobHandler<SimilarityScoringPayload> {

    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;

    public SimilarityScoringHandler(EmbeddingService embeddingService, ObjectMapper objectMapper) {
        super(JobType.SIMILARITY_SCORING, SimilarityScoringPayload.class);
        this.embeddingService = embeddingService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, SimilarityScoringPayload payload, ProgressReporter progress) {
        Algorithm algorithm = payload.getAlgorithm() != null ? payload.getAlgorithm() : Algorithm.SEMANTIC;
        progress.report(10, "Scoring similarity (" + algorithm.getId() + ")");

        double score = switch (algorithm) {
            case SYNTACTIC -> TextSimilarity.jaccard(payload.getSourceContent(), payload.getTargetContent());
            case SEMANTIC -> semantic(payload, progress);
            case HYBRID -> (TextSimilarity.jaccard(payload.getSourceContent(), payload.getTargetContent())
                + semantic(payload, progress)) / 2;
        };

        ObjectNode data = objectMapper.createObjectNode();
        data.put("sourceItemId", payload.getSourceItemId());
        data.put("targetItemId", payload.getTargetItemId());
        data.put("algorithm", algorithm.getId());
        data.put("score", score);

        return JobResult.builder()
            .summary(String.format("Similarity %s -> %s: %.3f",
                payload.getSourceItemId(), payload.getTargetItemId(), score))
            .data(data)
            .confidence(score)
            .build();
    }

    private double semantic(SimilarityScoringPayload payload, ProgressReporter progress) {
        float[] source = embeddingService.embed(payload.getUserId(), payload.getSourceContent(), null).getVector();
        progress.report(50, "Embedded source");
        float[] target = embeddingService.embed(payload.getUserId(), payload.getTargetContent(), null).getVector();
        progress.report(90, "Embedded target");
        try {
            return TextSimilarity.cosine(source, target);
        } catch (IllegalArgumentException e) {
            throw new PermanentExecutionException("Cannot compare embeddings: " + e.getMessage(), e);
        }
    }
}
