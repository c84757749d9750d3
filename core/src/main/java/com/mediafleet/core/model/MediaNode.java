package com.mediafleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Immutable identity and lifecycle record of a media node.
 * <p>
 * Every change produces a new instance; the registry publishes the latest one so
 * readers never observe a half-applied update.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class MediaNode {
    /**
     * Identifier assigned by the provisioning system (instance or pod name).
     */
    String id;

    MediaNodeState state;

    /**
     * Number of currently attached sessions. Never negative.
     */
    int usageCount;

    /**
     * When the launch was requested, or when the node was adopted (epoch millis).
     */
    long createdAt;

    /**
     * Timestamp of the most recent registration or deregistration (epoch millis).
     */
    long lastUsageChangeAt;

    /**
     * Set when usage reaches zero; {@code null} while sessions are attached.
     */
    Long idleSince;

    /**
     * Failed termination requests for the current termination.
     */
    int terminationAttempts;

    Origin origin;

    public static MediaNode launching(String id, long now) {
        return MediaNode.builder()
                .id(id)
                .state(MediaNodeState.LAUNCHING)
                .createdAt(now)
                .lastUsageChangeAt(now)
                .origin(Origin.LAUNCHED)
                .build();
    }

    public static MediaNode adopted(String id, long now) {
        return MediaNode.builder()
                .id(id)
                .state(MediaNodeState.RUNNING)
                .createdAt(now)
                .lastUsageChangeAt(now)
                .origin(Origin.ADOPTED)
                .build();
    }

    /**
     * @return true if a session may attach to this node in its current state
     */
    public boolean acceptsRegistrations() {
        return state == MediaNodeState.RUNNING || state == MediaNodeState.WAITING_IDLE_TO_TERMINATE;
    }

    /**
     * Sessions this node can still take, given a per-node capacity.
     */
    public int spareCapacity(int sessionsPerNode) {
        return Math.max(0, sessionsPerNode - usageCount);
    }

    /**
     * How the record entered the registry.
     */
    public enum Origin {
        /**
         * Requested by the autoscale engine through the provisioning gateway.
         */
        LAUNCHED,

        /**
         * Already running when the manager started (statically configured).
         */
        ADOPTED
    }
}
