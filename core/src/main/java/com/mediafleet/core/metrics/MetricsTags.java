package com.mediafleet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the manager instance identifier.
     */
    public static final String MANAGER_ID = "manager_id";

    /**
     * Tag key for media node lifecycle state.
     */
    public static final String STATE = "state";

    /**
     * Tag key for scaling action.
     */
    public static final String ACTION = "action";

    /**
     * Tag key for termination reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for provisioning request outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for the kind of contract violation.
     */
    public static final String KIND = "kind";

    /**
     * Tag key for Kafka topic.
     */
    public static final String TOPIC = "topic";

}
