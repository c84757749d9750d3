package com.mediafleet.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code mediafleet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Media node records in the registry.
     * <p>
     * Tags: state
     * </p>
     */
    public static final String REGISTRY_NODES = "mediafleet.registry.nodes";

    /**
     * Counter: Accepted session registrations.
     */
    public static final String USAGE_REGISTRATIONS_TOTAL = "mediafleet.usage.registrations.total";

    /**
     * Counter: Accepted session deregistrations.
     */
    public static final String USAGE_DEREGISTRATIONS_TOTAL = "mediafleet.usage.deregistrations.total";

    /**
     * Counter: Rejected lifecycle operations.
     * <p>
     * Tags: kind (invalid_state_transition/usage_underflow/node_not_found)
     * </p>
     */
    public static final String CONTRACT_VIOLATIONS_TOTAL = "mediafleet.contract.violations.total";

    /**
     * Counter: Autoscale decisions made.
     * <p>
     * Tags: action (launch/none)
     * </p>
     */
    public static final String SCALING_DECISIONS_TOTAL = "mediafleet.scaling.decisions.total";

    /**
     * Counter: Launch requests sent to the provisioning gateway.
     * <p>
     * Tags: outcome (requested/failed)
     * </p>
     */
    public static final String LAUNCH_REQUESTS_TOTAL = "mediafleet.provisioning.launch.requests.total";

    /**
     * Counter: Idle nodes moved to TERMINATING.
     * <p>
     * Tags: reason (grace_period/drop)
     * </p>
     */
    public static final String IDLE_TERMINATIONS_TOTAL = "mediafleet.idle.terminations.total";

    /**
     * Counter: Termination requests retried after a failure.
     */
    public static final String TERMINATION_RETRIES_TOTAL = "mediafleet.provisioning.termination.retries.total";

    /**
     * Counter: Terminations that exhausted their retries and need an operator.
     */
    public static final String TERMINATION_ESCALATIONS_TOTAL = "mediafleet.provisioning.termination.escalations.total";

    /**
     * Counter: Lifecycle events that could not be published.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String EVENT_PUBLISH_FAILURES_TOTAL = "mediafleet.events.publish.failures.total";
}
