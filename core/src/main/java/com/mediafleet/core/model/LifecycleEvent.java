package com.mediafleet.core.model;

/**
 * Events that drive a media node through its lifecycle.
 * <p>
 * {@link #LAUNCH_REQUESTED} and {@link #ADOPTED} create a record and are never
 * applied to an existing one. {@link #TERMINATION_CONFIRMED} and
 * {@link #CANCELLATION_FINALIZED} remove it.
 * </p>
 */
public enum LifecycleEvent {
    LAUNCH_REQUESTED,
    ADOPTED,
    PROVISIONING_CONFIRMED,
    PROVISIONING_ABORTED,
    USAGE_REACHED_ZERO,
    USAGE_RESUMED,
    GRACE_PERIOD_ELAPSED,
    DROP_REQUESTED,
    TERMINATION_CONFIRMED,
    CANCELLATION_FINALIZED
}
