package com.whereq.contextforge.model.payload;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload for BATCH_IMPORT jobs produced by the file and repository importers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchImportPayload implements JobPayload {

    @NotBlank
    private String userId;

    @NotBlank
    private String importId;

    /**
     * Collection imported items are filed under, optional
     */
    private String collectionId;

    @NotEmpty
    private List<@Valid @NotNull ImportFile> files;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportFile {
        @NotBlank
        private String path;

        @NotNull
        private String content;
    }
}
