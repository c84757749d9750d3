package com.mediafleet.core.error;

/**
 * Deregistration without a matching registration (usage already zero).
 */
public class UsageUnderflowException extends MediaNodeException {

    public UsageUnderflowException(String mediaNodeId) {
        super(mediaNodeId, "Media node " + mediaNodeId + " has no attached sessions to deregister");
    }
}
