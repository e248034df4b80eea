package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.integration.AiResponse;
import com.whereq.contextforge.integration.ContentIntelligenceService;
import com.whereq.contextforge.integration.ItemStore;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.ClassificationPayload;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies content (prompt, agent, rule, template...) through the AI gateway
 * and stores the detected type on the item
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class ClassificationHandler extends AbstractJobHandler<ClassificationPayload> {

    private final ContentIntelligenceService intelligenceService;
    private final ItemStore itemStore;
    private final ObjectMapper objectMapper;

    public ClassificationHandler(ContentIntelligenceService intelligenceService,
                                 ItemStore itemStore,
                                 ObjectMapper objectMapper) {
        super(JobType.CLASSIFICATION, ClassificationPayload.class);
        this.intelligenceService = intelligenceService;
        this.itemStore = itemStore;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, ClassificationPayload payload, ProgressReporter progress) {
        progress.report(10, "Starting classification analysis");
        ContentCharacteristics characteristics = ContentCharacteristics.analyze(payload.getContent(), payload.getFormat());

        progress.report(30, "Classifying content");
        AiResponse response = intelligenceService.classify(
            payload.getUserId(), payload.getContent(), payload.getFormat(), payload.getTargetModels());

        progress.report(80, "Saving results");
        String type = textField(response.getMetadata(), "type");
        String subType = textField(response.getMetadata(), "subType");
        if (payload.getItemId() != null && type != null) {
            itemStore.updateClassification(payload.getItemId(), type, subType)
                .ifPresentOrElse(
                    item -> log.debug("Item {} classified as {}/{}", item.getId(), type, subType),
                    () -> log.warn("Item {} no longer exists, classification not stored", payload.getItemId()));
        }

        ObjectNode data = objectMapper.createObjectNode();
        data.put("classification", response.getContent());
        data.put("type", type);
        data.put("subType", subType);
        data.put("model", response.getModel());
        data.set("characteristics", objectMapper.valueToTree(characteristics));
        data.set("metadata", response.getMetadata());

        return JobResult.builder()
            .summary("Classified as " + (type != null ? type : response.getContent()))
            .data(data)
            .confidence(response.getConfidence())
            .tokensUsed(response.getTokens())
            .build();
    }

    private static String textField(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        return node.get(field).asText();
    }
}
