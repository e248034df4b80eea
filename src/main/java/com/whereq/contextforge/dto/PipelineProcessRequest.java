package com.whereq.contextforge.dto;

import com.whereq.contextforge.model.TargetModel;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to run the pipeline for one item, a list of items or a collection
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Pipeline processing request; the fields used depend on the mode")
public class PipelineProcessRequest {

    @Schema(description = "Item to process (mode=single)")
    private String itemId;

    @Schema(description = "Items to process (mode=batch)")
    private List<String> itemIds;

    @Schema(description = "Collection whose items are processed (mode=collection)")
    private String collectionId;

    @Schema(description = "Reprocess items that were already optimized")
    private boolean forceReprocess;

    @Schema(description = "Models to optimize for", example = "[\"openai\", \"anthropic\"]")
    private List<TargetModel> targetModels;

    @Schema(description = "Skip items that already have an optimization")
    private boolean skipIfOptimized;
}
