package com.whereq.contextforge.model.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload for SIMILARITY_SCORING jobs, one per (source, target) pair
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityScoringPayload implements JobPayload {

    @NotBlank
    private String userId;

    @NotNull
    private String sourceContent;

    @NotNull
    private String targetContent;

    @NotNull
    @Builder.Default
    private Algorithm algorithm = Algorithm.SEMANTIC;

    @NotBlank
    private String sourceItemId;

    @NotBlank
    private String targetItemId;

    public enum Algorithm {
        SEMANTIC,
        SYNTACTIC,
        HYBRID;

        @JsonValue
        public String getId() {
            return name().toLowerCase();
        }

        @JsonCreator
        public static Algorithm fromId(String value) {
            return Algorithm.valueOf(value.trim().toUpperCase());
        }
    }
}
