package com.whereq.contextforge.dto;

import com.whereq.contextforge.model.payload.SimilarityScoringPayload.Algorithm;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request for duplicate detection (mode=detect) or similarity scoring (mode=similarity)
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateDetectionRequest {

    @Schema(description = "Restrict detection to one collection")
    private String collectionId;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "Similarity threshold, validated but not applied: detection always runs at 0.8", example = "0.8")
    private Double threshold;

    private String sourceItemId;

    private List<String> targetItemIds;

    @Schema(description = "semantic, syntactic or hybrid", example = "semantic")
    private Algorithm algorithm;
}
