package com.whereq.contextforge.model.payload;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for QUALITY_ASSESSMENT jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityAssessmentPayload implements JobPayload {

    @NotBlank
    private String userId;

    private String itemId;

    @NotBlank
    private String content;

    /**
     * Item kind (prompt, agent, rule, template, other)
     */
    @NotBlank
    private String type;

    @NotBlank
    private String format;
}
