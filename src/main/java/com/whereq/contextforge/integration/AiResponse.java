package com.whereq.contextforge.integration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response of the AI gateway for classification, optimization and quality requests
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiResponse {
    /**
     * Generated text: the classification, optimized content or assessment
     */
    private String content;

    private Double confidence;

    private Integer tokens;

    /**
     * Model that served the request
     */
    private String model;

    /**
     * Structured details returned alongside the content
     */
    private JsonNode metadata;
}
