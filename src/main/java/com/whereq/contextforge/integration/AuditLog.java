package com.whereq.contextforge.integration;

import com.whereq.contextforge.model.AuditEvent;

/**
 * Append-only audit trail
 */
public interface AuditLog {

    void append(AuditEvent event);
}
