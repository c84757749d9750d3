package com.mediafleet.manager.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for the media fleet manager, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ManagerConfig {

    String nodeId;
    int httpPort;
    String kafkaBootstrap;
    boolean eventsEnabled;

    // Idle reaping
    Duration idleGracePeriod;
    Duration canceledRetention;  // how long a CANCELED record stays queryable

    // Autoscale parameters
    int sessionsPerNode;         // session capacity of one media node
    int minSpareSessions;        // launch when fleet spare capacity drops below this
    int maxNodes;                // live records (not TERMINATING/CANCELED) cap

    // Termination retry policy
    int terminationMaxRetries;
    Duration terminationRetryBase;
    Duration terminationRetryMax;
    Duration terminationRetryJitter;

    // Kubernetes provisioning
    String kubernetesNamespace;
    String mediaNodeImage;
    String mediaNodeLabel;

    // Nodes already running at startup, registered as RUNNING
    List<String> adoptedMediaNodes;

    public static ManagerConfig fromEnv() {
        return ManagerConfig.builder()
            .nodeId(getEnv("NODE_ID", "media-fleet-manager-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8082")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .eventsEnabled(Boolean.parseBoolean(getEnv("EVENTS_ENABLED", "true")))
            .idleGracePeriod(Duration.ofSeconds(Long.parseLong(getEnv("IDLE_GRACE_PERIOD_SEC", "300"))))
            .canceledRetention(Duration.ofSeconds(Long.parseLong(getEnv("CANCELED_RETENTION_SEC", "60"))))
            .sessionsPerNode(Integer.parseInt(getEnv("SESSIONS_PER_NODE", "50")))
            .minSpareSessions(Integer.parseInt(getEnv("MIN_SPARE_SESSIONS", "10")))
            .maxNodes(Integer.parseInt(getEnv("MAX_NODES", "20")))
            .terminationMaxRetries(Integer.parseInt(getEnv("TERMINATION_MAX_RETRIES", "5")))
            .terminationRetryBase(Duration.ofMillis(Long.parseLong(getEnv("TERMINATION_RETRY_BASE_MS", "1000"))))
            .terminationRetryMax(Duration.ofMillis(Long.parseLong(getEnv("TERMINATION_RETRY_MAX_MS", "30000"))))
            .terminationRetryJitter(Duration.ofMillis(Long.parseLong(getEnv("TERMINATION_RETRY_JITTER_MS", "500"))))
            .kubernetesNamespace(getEnv("KUBERNETES_NAMESPACE", "default"))
            .mediaNodeImage(getEnv("MEDIA_NODE_IMAGE", "kurento/kurento-media-server:7.0"))
            .mediaNodeLabel(getEnv("MEDIA_NODE_LABEL", "media-node"))
            .adoptedMediaNodes(parseIdList(getEnv("ADOPTED_MEDIA_NODES", "")))
            .build();
    }

    /**
     * Splits a comma-separated id list, dropping blanks and surrounding whitespace.
     */
    public static List<String> parseIdList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(id -> !id.isEmpty())
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
