package com.whereq.contextforge.integration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embedding vector produced by the AI gateway
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {
    private float[] vector;

    private String model;

    private Integer tokens;

    public int getDimensions() {
        return vector == null ? 0 : vector.length;
    }
}
