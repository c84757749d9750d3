package com.mediafleet.manager;

import com.mediafleet.manager.config.ManagerConfig;
import com.mediafleet.manager.events.ILifecycleEventPublisher;
import com.mediafleet.manager.events.LoggingLifecycleEventPublisher;
import com.mediafleet.manager.http.HttpServer;
import com.mediafleet.manager.kafka.KafkaLifecycleEventPublisher;
import com.mediafleet.manager.lifecycle.MediaNodeManager;
import com.mediafleet.manager.metrics.PrometheusMetricsExporter;
import com.mediafleet.manager.provisioning.IProvisioningGateway;
import com.mediafleet.manager.provisioning.KubernetesProvisioningGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;

public class MediaFleetManagerApp {
    private static final Logger log = LoggerFactory.getLogger(MediaFleetManagerApp.class);

    public static void main(String[] args) {
        // Set virtual threads property BEFORE any Reactor scheduler is created
        System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");

        ManagerConfig config = ManagerConfig.fromEnv();

        log.info("Starting Media Fleet Manager {}", config.getNodeId());
        log.info("  Kafka: {} (events enabled: {})", config.getKafkaBootstrap(), config.isEventsEnabled());
        log.info("  Namespace: {}, image: {}", config.getKubernetesNamespace(), config.getMediaNodeImage());
        log.info("  Idle grace period: {}, sessions per node: {}, min spare sessions: {}, max nodes: {}",
            config.getIdleGracePeriod(), config.getSessionsPerNode(), config.getMinSpareSessions(), config.getMaxNodes());

        // Setup metrics
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());

        // Initialize components
        ILifecycleEventPublisher eventPublisher = config.isEventsEnabled()
            ? new KafkaLifecycleEventPublisher(config)
            : new LoggingLifecycleEventPublisher();
        IProvisioningGateway gateway = new KubernetesProvisioningGateway(config);
        MediaNodeManager manager = new MediaNodeManager(
            config,
            gateway,
            eventPublisher,
            metricsExporter.getRegistry(),
            Schedulers.parallel()
        );

        // Start HTTP server
        HttpServer httpServer = new HttpServer(config, manager, metricsExporter);
        DisposableServer disposableServer = httpServer.start();

        manager.start();

        log.info("Media Fleet Manager is ready");

        handleShutDown(manager, gateway, eventPublisher, httpServer);

        disposableServer.onDispose().block();
    }

    private static void handleShutDown(
        MediaNodeManager manager,
        IProvisioningGateway gateway,
        ILifecycleEventPublisher eventPublisher,
        HttpServer httpServer
    ) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down Media Fleet Manager...");

            // Stop accepting registrations and drain timers first
            manager.shutdown();

            httpServer.stop();

            gateway.close();

            eventPublisher.close();

            log.info("Shutdown complete");
        }));
    }
}
