package com.soarsentinel.core.playbook.actions;

/**
 * Endpoint detection and response console used by {@link IsolateHostAction}.
 */
public interface EndpointClient {

    /**
     * @return an identifier of the isolation request
     */
    String isolate(String hostId, String reason);

    void release(String hostId, String isolationId);
}
