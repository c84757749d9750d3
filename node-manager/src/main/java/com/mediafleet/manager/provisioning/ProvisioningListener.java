package com.mediafleet.manager.provisioning;

/**
 * Out-of-band confirmations from the provisioning gateway.
 * <p>
 * Implementations may throw {@link com.mediafleet.core.error.MediaNodeException}
 * when a confirmation does not match the node's state; gateways log and drop those.
 * </p>
 */
public interface ProvisioningListener {

    /**
     * The node finished provisioning and can host sessions.
     */
    void confirmAvailable(String mediaNodeId);

    /**
     * The launch failed or was aborted before the node became available.
     */
    void abortLaunch(String mediaNodeId, String reason);

    /**
     * The node's instance is gone.
     */
    void confirmTerminated(String mediaNodeId);

    /**
     * A termination that was accepted earlier did not complete.
     */
    void terminationFailed(String mediaNodeId, String reason);
}
