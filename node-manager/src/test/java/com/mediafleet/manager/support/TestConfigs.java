package com.mediafleet.manager.support;

import com.mediafleet.manager.config.ManagerConfig;

import java.time.Duration;
import java.util.List;

/**
 * Configuration used by manager tests: autoscaling off unless a test enables it.
 */
public final class TestConfigs {
    public static final Duration GRACE = Duration.ofSeconds(60);

    private TestConfigs() {
    }

    public static ManagerConfig defaults() {
        return ManagerConfig.builder()
            .nodeId("test-manager")
            .httpPort(0)
            .kafkaBootstrap("localhost:9092")
            .eventsEnabled(false)
            .idleGracePeriod(GRACE)
            .canceledRetention(Duration.ofSeconds(5))
            .sessionsPerNode(10)
            .minSpareSessions(0)
            .maxNodes(5)
            .terminationMaxRetries(2)
            .terminationRetryBase(Duration.ofMillis(100))
            .terminationRetryMax(Duration.ofSeconds(1))
            .terminationRetryJitter(Duration.ZERO)
            .kubernetesNamespace("test")
            .mediaNodeImage("kurento/kurento-media-server:7.0")
            .mediaNodeLabel("media-node")
            .adoptedMediaNodes(List.of())
            .build();
    }
}
