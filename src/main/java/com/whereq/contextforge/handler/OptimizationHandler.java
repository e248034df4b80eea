package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.integration.AiResponse;
import com.whereq.contextforge.integration.ContentIntelligenceService;
import com.whereq.contextforge.integration.ItemStore;
import com.whereq.contextforge.model.ContentItem;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.OptimizationPayload;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;

import java.time.Instant;

/**
 * Rewrites content for one target model and records the optimization on the item
 *
 * @author WhereQ Inc.
 */
public class OptimizationHandler extends AbstractJobHandler<OptimizationPayload> {

    private final ContentIntelligenceService intelligenceService;
    private final ItemStore itemStore;
    private final ObjectMapper objectMapper;

    public OptimizationHandler(ContentIntelligenceService intelligenceService,
                               ItemStore itemStore,
                               ObjectMapper objectMapper) {
        super(JobType.OPTIMIZATION, OptimizationPayload.class);
        this.intelligenceService = intelligenceService;
        this.itemStore = itemStore;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, OptimizationPayload payload, ProgressReporter progress) {
        progress.report(10, "Optimizing for " + payload.getTargetModel().getId());
        AiResponse response = intelligenceService.optimize(
            payload.getUserId(), payload.getContent(), payload.getCurrentFormat(), payload.getTargetModel());

        progress.report(90, "Saving optimization");
        if (payload.getItemId() != null) {
            itemStore.recordOptimization(payload.getItemId(), ContentItem.ItemOptimization.builder()
                .targetModel(payload.getTargetModel())
                .createdAt(Instant.now())
                .build());
        }

        ObjectNode data = objectMapper.createObjectNode();
        data.put("targetModel", payload.getTargetModel().getId());
        data.put("optimizedContent", response.getContent());
        data.put("model", response.getModel());
        data.set("metadata", response.getMetadata());

        return JobResult.builder()
            .summary("Optimized for " + payload.getTargetModel().getId())
            .data(data)
            .confidence(response.getConfidence())
            .tokensUsed(response.getTokens())
            .build();
    }
}
