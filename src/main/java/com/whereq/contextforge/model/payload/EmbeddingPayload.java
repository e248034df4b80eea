package com.whereq.contextforge.model.payload;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for EMBEDDING jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingPayload implements JobPayload {

    @NotBlank
    private String userId;

    private String itemId;

    @NotBlank
    private String content;

    /**
     * Embedding provider override, gateway default when absent
     */
    private String providerId;
}
