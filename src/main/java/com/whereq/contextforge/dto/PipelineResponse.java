package com.whereq.contextforge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Acknowledgement of a pipeline request
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineResponse {
    private boolean success;

    private String message;

    private String itemId;

    private Integer itemCount;

    private String collectionId;

    private String sourceItemId;

    private Integer targetCount;

    /**
     * Jobs created synchronously by the request
     */
    private List<String> jobIds;

    public static PipelineResponse error(String message) {
        return PipelineResponse.builder()
            .success(false)
            .message(message)
            .build();
    }
}
