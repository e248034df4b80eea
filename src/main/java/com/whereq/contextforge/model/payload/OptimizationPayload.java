package com.whereq.contextforge.model.payload;

import com.whereq.contextforge.model.TargetModel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for OPTIMIZATION jobs, one per target model
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationPayload implements JobPayload {

    @NotBlank
    private String userId;

    private String itemId;

    @NotBlank
    private String content;

    @NotNull
    private TargetModel targetModel;

    @NotBlank
    private String currentFormat;
}
