package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.TargetModel;

import java.util.List;

/**
 * LLM-backed content analysis. Calls block and may throw
 * {@link com.whereq.contextforge.exception.JobExecutionException}.
 */
public interface ContentIntelligenceService {

    AiResponse classify(String userId, String content, String format, List<TargetModel> targetModels);

    AiResponse optimize(String userId, String content, String currentFormat, TargetModel targetModel);

    AiResponse assessQuality(String userId, String content, String type, String format);
}
