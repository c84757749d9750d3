package com.mediafleet.core.error;

/**
 * The provisioning gateway failed to launch or terminate a node.
 * <p>
 * Recoverable: a failed launch is retried on the next registration, a failed
 * termination is retried with backoff until the retry budget is spent.
 * </p>
 */
public class ProvisioningFailureException extends MediaNodeException {

    public ProvisioningFailureException(String mediaNodeId, String message) {
        super(mediaNodeId, message);
    }

    public ProvisioningFailureException(String mediaNodeId, String message, Throwable cause) {
        super(mediaNodeId, message, cause);
    }
}
