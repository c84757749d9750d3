package com.mediafleet.core.model;

/**
 * Lifecycle state of a media node.
 * <p>
 * Exactly one state holds for a node at any instant. A node record leaves the
 * registry only from {@link #TERMINATING} or {@link #CANCELED}.
 * </p>
 */
public enum MediaNodeState {
    /**
     * Provisioning was requested; the node cannot host sessions yet.
     */
    LAUNCHING,

    /**
     * Provisioning confirmed; the node accepts session registrations.
     */
    RUNNING,

    /**
     * Usage dropped to zero; the idle grace period is counting down.
     * A new registration brings the node back to {@link #RUNNING}.
     */
    WAITING_IDLE_TO_TERMINATE,

    /**
     * Termination was requested from the provisioning gateway. No new work is accepted.
     */
    TERMINATING,

    /**
     * The launch was aborted before the node became available.
     */
    CANCELED
}
