package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.model.MediaNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Interface for media node lifecycle management (Dependency Inversion Principle).
 * <p>
 * Session routing calls the usage operations when sessions attach and detach, and
 * the state predicates to pick a usable node. The real manager, the no-op stand-in
 * and test doubles are interchangeable behind this interface.
 * </p>
 */
public interface IMediaNodeManager {

    /**
     * Records a session attaching to a node and lets the autoscaler react.
     *
     * @param node              node the session attaches to
     * @param timeOfConnection  event timestamp (epoch millis)
     * @param existingNodes     fleet view used for the autoscale decision; not mutated
     * @throws com.mediafleet.core.error.InvalidStateTransitionException if the node does not accept sessions
     * @throws com.mediafleet.core.error.NodeNotFoundException if the node is unknown
     */
    void mediaNodeUsageRegistration(MediaNode node, long timeOfConnection, Collection<MediaNode> existingNodes);

    /**
     * Records a session detaching from a node. The last detach starts the idle grace period.
     *
     * @throws com.mediafleet.core.error.UsageUnderflowException if the node has no attached session
     * @throws com.mediafleet.core.error.NodeNotFoundException if the node is unknown
     */
    void mediaNodeUsageDeregistration(MediaNode node, long timeOfDisconnection);

    /**
     * Terminates an idle node now instead of at the end of its grace period.
     * No-op unless the node is waiting idle to terminate.
     */
    void dropIdleMediaNode(String mediaNodeId);

    boolean isLaunching(String mediaNodeId);

    boolean isCanceled(String mediaNodeId);

    boolean isRunning(String mediaNodeId);

    boolean isTerminating(String mediaNodeId);

    boolean isWaitingIdleToTerminate(String mediaNodeId);

    Optional<MediaNode> getMediaNode(String mediaNodeId);

    List<MediaNode> getMediaNodes();

    /**
     * Starts processing provisioning confirmations and runs the startup autoscale evaluation.
     */
    void start();

    /**
     * Rejects further registrations and drains pending timers.
     */
    void shutdown();
}
