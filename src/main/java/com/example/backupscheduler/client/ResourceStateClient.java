package com.example.backupscheduler.client;

/**
 * Lookup of managed server state, owned by the server management service.
 */
public interface ResourceStateClient {

    /**
     * @return true when the server process is currently running
     * @throws com.example.backupscheduler.exception.ExternalCollaboratorException if the state cannot be determined
     */
    boolean isResourceActive(String resourceId);

    /**
     * @return false when the server management service does not know the server
     * @throws com.example.backupscheduler.exception.ExternalCollaboratorException if existence cannot be determined
     */
    boolean resourceExists(String resourceId);
}
