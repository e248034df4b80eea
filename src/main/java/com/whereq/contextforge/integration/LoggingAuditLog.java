package com.whereq.contextforge.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.contextforge.model.AuditEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as JSON lines to the {@code contextforge.audit} logger
 */
@Slf4j(topic = "contextforge.audit")
public class LoggingAuditLog implements AuditLog {

    private final ObjectMapper objectMapper;

    public LoggingAuditLog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(AuditEvent event) {
        try {
            log.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit event {} for {}, writing plain form: {}",
                event.getAction(), event.getEntityId(), event, e);
        }
    }
}
