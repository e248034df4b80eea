package com.whereq.contextforge.model.payload;

import com.whereq.contextforge.model.TargetModel;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload for CLASSIFICATION jobs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationPayload implements JobPayload {

    @NotBlank
    private String userId;

    private String itemId;

    @NotBlank
    private String content;

    @NotBlank
    private String format;

    /**
     * Models the classification should consider, optional
     */
    private List<TargetModel> targetModels;
}
