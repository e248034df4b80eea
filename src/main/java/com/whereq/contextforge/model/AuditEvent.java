package com.whereq.contextforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Audit log entry written by the pipeline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private String userId;

    private String action;

    private String entityType;

    private String entityId;

    private Map<String, Object> metadata;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
