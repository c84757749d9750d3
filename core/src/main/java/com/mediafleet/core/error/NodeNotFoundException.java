package com.mediafleet.core.error;

public class NodeNotFoundException extends MediaNodeException {

    public NodeNotFoundException(String mediaNodeId) {
        super(mediaNodeId, "Media node " + mediaNodeId + " is not registered");
    }
}
