package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.integration.EmbeddingResponse;
import com.whereq.contextforge.integration.EmbeddingService;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.EmbeddingPayload;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;

public class EmbeddingHandler extends AbstractJobHandler<EmbeddingPayload> {

    private final EmbeddingService embeddingService;
    private final ObjectMapper objectMapper;

    public EmbeddingHandler(EmbeddingService embeddingService, ObjectMapper objectMapper) {
        super(JobType.EMBEDDING, EmbeddingPayload.class);
        this.embeddingService = embeddingService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, EmbeddingPayload payload, ProgressReporter progress) {
        progress.report(10, "Generating embedding");
        EmbeddingResponse response = embeddingService.embed(
            payload.getUserId(), payload.getContent(), payload.getProviderId());

        ObjectNode data = objectMapper.createObjectNode();
        data.put("itemId", payload.getItemId());
        data.put("model", response.getModel());
        data.put("dimensions", response.getDimensions());
        ArrayNode vector = data.putArray("vector");
        if (response.getVector() != null) {
            for (float value : response.getVector()) {
                vector.add(value);
            }
        }

        return JobResult.builder()
            .summary("Embedded " + response.getDimensions() + " dimensions")
            .data(data)
            .tokensUsed(response.getTokens())
            .build();
    }
}
