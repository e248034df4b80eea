package com.whereq.contextforge.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.contextforge.model.JobPriority;
import com.whereq.contextforge.model.JobType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to create a single job directly
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotNull
    @Schema(description = "Job type", example = "CLASSIFICATION")
    private JobType type;

    @NotNull
    @Schema(description = "Payload for the job type; userId is set from the caller")
    private JsonNode data;

    private JobPriority priority;

    @Min(1)
    @Schema(description = "Total execution budget", example = "3")
    private Integer maxAttempts;
}
