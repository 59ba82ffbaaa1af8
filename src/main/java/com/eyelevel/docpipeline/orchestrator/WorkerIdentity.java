package com.eyelevel.docpipeline.orchestrator;

import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * The name this process writes into execution leases.
 */
public final class WorkerIdentity {

    private final String id;

    public WorkerIdentity(final String configuredId) {
        this.id = StringUtils.hasText(configuredId) ? configuredId.trim() : "worker-" + UUID.randomUUID();
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
