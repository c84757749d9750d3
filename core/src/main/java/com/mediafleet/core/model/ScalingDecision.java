package com.mediafleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Outcome of one autoscale evaluation.
 * <p>
 * The autoscale engine computes this after every session registration from the
 * fleet view it was given. A {@link Action#LAUNCH} decision means a launch request
 * was handed to the provisioning gateway.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class ScalingDecision {
    Action action;

    /**
     * Aggregate spare sessions across RUNNING and LAUNCHING nodes at decision time.
     */
    int spareCapacity;

    /**
     * Human-readable reason for this decision.
     */
    String reason;

    long timestampMs;

    public enum Action {
        /**
         * Capacity is sufficient, or a launch is already outstanding.
         */
        NONE,

        /**
         * A new media node launch was requested.
         */
        LAUNCH
    }
}
