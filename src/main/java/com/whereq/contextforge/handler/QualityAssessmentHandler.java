package com.whereq.contextforge.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.contextforge.integration.AiResponse;
import com.whereq.contextforge.integration.ContentIntelligenceService;
import com.whereq.contextforge.model.Job;
import com.whereq.contextforge.model.JobResult;
import com.whereq.contextforge.model.JobType;
import com.whereq.contextforge.model.payload.QualityAssessmentPayload;
import com.whereq.contextforge.worker.AbstractJobHandler;
import com.whereq.contextforge.worker.ProgressReporter;

public class QualityAssessmentHandler extends AbstractJobHandler<QualityAssessmentPayload> {

    private final ContentIntelligenceService intelligenceService;
    private final ObjectMapper objectMapper;

    public QualityAssessmentHandler(ContentIntelligenceService intelligenceService, ObjectMapper objectMapper) {
        super(JobType.QUALITY_ASSESSMENT, QualityAssessmentPayload.class);
        this.intelligenceService = intelligenceService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected JobResult handle(Job job, QualityAssessmentPayload payload, ProgressReporter progress) {
        progress.report(10, "Analyzing content structure");
        ContentCharacteristics characteristics = ContentCharacteristics.analyze(payload.getContent(), payload.getFormat());

        progress.report(35, "Assessing quality");
        AiResponse response = intelligenceService.assessQuality(
            payload.getUserId(), payload.getContent(), payload.getType(), payload.getFormat());

        ObjectNode data = objectMapper.createObjectNode();
        data.put("assessment", response.getContent());
        data.put("model", response.getModel());
        data.set("characteristics", objectMapper.valueToTree(characteristics));
        data.set("metrics", response.getMetadata());

        return JobResult.builder()
            .summary("Quality assessed for " + payload.getType())
            .data(data)
            .confidence(response.getConfidence())
            .tokensUsed(response.getTokens())
            .build();
    }
}
