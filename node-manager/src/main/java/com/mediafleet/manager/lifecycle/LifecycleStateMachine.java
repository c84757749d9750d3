package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.error.InvalidStateTransitionException;
import com.mediafleet.core.model.LifecycleEvent;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.model.MediaNodeState;
import com.mediafleet.manager.registry.MediaNodeRegistry;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.mediafleet.core.model.LifecycleEvent.*;
import static com.mediafleet.core.model.MediaNodeState.*;

/**
 * Valid lifecycle transitions of a media node, and state queries against the registry.
 * <p>
 * Transitions not in the table are rejected with
 * {@link InvalidStateTransitionException}; an unexpected event is never coerced.
 * An empty target means the record is removed.
 * </p>
 * <pre>
 *   LAUNCHING                 --PROVISIONING_CONFIRMED--> RUNNING
 *   LAUNCHING                 --PROVISIONING_ABORTED----> CANCELED
 *   RUNNING                   --USAGE_REACHED_ZERO------> WAITING_IDLE_TO_TERMINATE
 *   WAITING_IDLE_TO_TERMINATE --USAGE_RESUMED-----------> RUNNING
 *   WAITING_IDLE_TO_TERMINATE --GRACE_PERIOD_ELAPSED----> TERMINATING
 *   WAITING_IDLE_TO_TERMINATE --DROP_REQUESTED----------> TERMINATING
 *   TERMINATING               --TERMINATION_CONFIRMED---> (removed)
 *   CANCELED                  --CANCELLATION_FINALIZED--> (removed)
 * </pre>
 * <p>
 * Query predicates read the registry's published value without locking; the state
 * may change right after the call returns.
 * </p>
 */
public class LifecycleStateMachine {

    private static final Map<MediaNodeState, Map<LifecycleEvent, Optional<MediaNodeState>>> TRANSITIONS =
        new EnumMap<>(MediaNodeState.class);

    static {
        for (MediaNodeState state : MediaNodeState.values()) {
            TRANSITIONS.put(state, new EnumMap<>(LifecycleEvent.class));
        }
        allow(LAUNCHING, PROVISIONING_CONFIRMED, RUNNING);
        allow(LAUNCHING, PROVISIONING_ABORTED, CANCELED);
        allow(RUNNING, USAGE_REACHED_ZERO, WAITING_IDLE_TO_TERMINATE);
        allow(WAITING_IDLE_TO_TERMINATE, USAGE_RESUMED, RUNNING);
        allow(WAITING_IDLE_TO_TERMINATE, GRACE_PERIOD_ELAPSED, TERMINATING);
        allow(WAITING_IDLE_TO_TERMINATE, DROP_REQUESTED, TERMINATING);
        allow(TERMINATING, TERMINATION_CONFIRMED, null);
        allow(CANCELED, CANCELLATION_FINALIZED, null);
    }

    private static void allow(MediaNodeState from, LifecycleEvent event, MediaNodeState to) {
        TRANSITIONS.get(from).put(event, Optional.ofNullable(to));
    }

    private final MediaNodeRegistry registry;

    public LifecycleStateMachine(MediaNodeRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolves the target of {@code event} from {@code from}.
     *
     * @return the next state, or empty if the event removes the record
     * @throws InvalidStateTransitionException if the transition is not in the table
     */
    public Optional<MediaNodeState> next(String nodeId, MediaNodeState from, LifecycleEvent event) {
        Optional<MediaNodeState> target = TRANSITIONS.get(from).get(event);
        if (target == null) {
            throw new InvalidStateTransitionException(nodeId, from, event);
        }
        return target;
    }

    /**
     * Applies a non-removing event to a node.
     *
     * @return the node in its new state
     */
    public MediaNode transition(MediaNode node, LifecycleEvent event) {
        MediaNodeState target = next(node.getId(), node.getState(), event)
            .orElseThrow(() -> new InvalidStateTransitionException(node.getId(), node.getState(),
                event.name() + " (removes the record, use checkRemoval)"));
        return node.withState(target);
    }

    /**
     * Verifies that {@code event} removes the node in its current state.
     */
    public void checkRemoval(MediaNode node, LifecycleEvent event) {
        if (next(node.getId(), node.getState(), event).isPresent()) {
            throw new InvalidStateTransitionException(node.getId(), node.getState(), event);
        }
    }

    public Map<LifecycleEvent, Optional<MediaNodeState>> transitionsFrom(MediaNodeState state) {
        return Collections.unmodifiableMap(TRANSITIONS.get(state));
    }

    public boolean isLaunching(String mediaNodeId) {
        return isIn(mediaNodeId, LAUNCHING);
    }

    public boolean isCanceled(String mediaNodeId) {
        return isIn(mediaNodeId, CANCELED);
    }

    public boolean isRunning(String mediaNodeId) {
        return isIn(mediaNodeId, RUNNING);
    }

    public boolean isTerminating(String mediaNodeId) {
        return isIn(mediaNodeId, TERMINATING);
    }

    public boolean isWaitingIdleToTerminate(String mediaNodeId) {
        return isIn(mediaNodeId, WAITING_IDLE_TO_TERMINATE);
    }

    private boolean isIn(String mediaNodeId, MediaNodeState state) {
        return registry.get(mediaNodeId)
            .map(node -> node.getState() == state)
            .orElse(false);
    }
}
