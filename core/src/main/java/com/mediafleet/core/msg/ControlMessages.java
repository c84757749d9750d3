package com.mediafleet.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mediafleet.core.model.LifecycleEvent;
import com.mediafleet.core.model.MediaNodeState;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Control messages published by the media fleet manager.
 * <p>
 * These messages flow over Kafka control topics so that session routers and
 * dashboards can follow the fleet without querying the manager.
 * </p>
 */
public final class ControlMessages {
    private ControlMessages() {
    }

    /**
     * Published after every lifecycle transition of a media node, including
     * record creation ({@code from == null}) and removal ({@code to == null}).
     */
    @Value
    @Builder(toBuilder = true)
    @With
    public static class LifecycleTransition {
        @JsonProperty("nodeId")
        String nodeId;

        @JsonProperty("from")
        MediaNodeState from;

        @JsonProperty("to")
        MediaNodeState to;

        @JsonProperty("event")
        LifecycleEvent event;

        /**
         * Attached sessions right after the transition.
         */
        @JsonProperty("usageCount")
        int usageCount;

        /**
         * Timestamp when the transition happened (epoch millis).
         */
        @JsonProperty("ts")
        long ts;

        @JsonCreator
        public LifecycleTransition(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("from") MediaNodeState from,
            @JsonProperty("to") MediaNodeState to,
            @JsonProperty("event") LifecycleEvent event,
            @JsonProperty("usageCount") int usageCount,
            @JsonProperty("ts") long ts
        ) {
            this.nodeId = nodeId;
            this.from = from;
            this.to = to;
            this.event = event;
            this.usageCount = usageCount;
            this.ts = ts;
        }
    }
}
