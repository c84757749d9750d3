package com.mediafleet.core.error;

import com.mediafleet.core.model.LifecycleEvent;
import com.mediafleet.core.model.MediaNodeState;
import lombok.Getter;

/**
 * An event or operation is not valid for the node's current state.
 * The registry is left unchanged.
 */
@Getter
public class InvalidStateTransitionException extends MediaNodeException {
    private final MediaNodeState state;
    private final String attempted;

    public InvalidStateTransitionException(String mediaNodeId, MediaNodeState state, LifecycleEvent event) {
        this(mediaNodeId, state, event.name());
    }

    public InvalidStateTransitionException(String mediaNodeId, MediaNodeState state, String attempted) {
        super(mediaNodeId, String.format("Media node %s in state %s does not accept %s", mediaNodeId, state, attempted));
        this.state = state;
        this.attempted = attempted;
    }
}
