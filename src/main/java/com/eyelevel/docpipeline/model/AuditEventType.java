package com.eyelevel.docpipeline.model;

/**
 * Manual operations that reopen a terminal execution and are therefore recorded in its audit trail.
 */
public enum AuditEventType {
    REPLAY,
    RETRY_FROM_STAGE
}
