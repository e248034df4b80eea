package com.whereq.contextforge.integration;

/**
 * Text embeddings. Calls block and may throw
 * {@link com.whereq.contextforge.exception.JobExecutionException}.
 */
public interface EmbeddingService {

    /**
     * @param providerId embedding provider, null for the gateway default
     */
    EmbeddingResponse embed(String userId, String content, String providerId);
}
