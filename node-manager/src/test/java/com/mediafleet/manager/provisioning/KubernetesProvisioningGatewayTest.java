package com.mediafleet.manager.provisioning;

import com.mediafleet.core.error.InvalidStateTransitionException;
import com.mediafleet.core.error.ProvisioningFailureException;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.model.MediaNodeState;
import com.mediafleet.manager.lifecycle.MediaNodeManager;
import com.mediafleet.manager.support.RecordingEventPublisher;
import com.mediafleet.manager.support.TestConfigs;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.Watcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Pod event translation and API failure mapping, against an unreachable API server.
 */
class KubernetesProvisioningGatewayTest {

    private KubernetesClient client;
    private KubernetesProvisioningGateway gateway;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        Config config = new ConfigBuilder()
            .withMasterUrl("https://127.0.0.1:1")
            .withRequestRetryBackoffLimit(0)
            .build();
        client = new KubernetesClientBuilder().withConfig(config).build();
        gateway = new KubernetesProvisioningGateway(client, TestConfigs.defaults());
        listener = new RecordingListener();
        gateway.attach(listener);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static Pod pod(String name, String phase, boolean ready) {
        return new PodBuilder()
            .withNewMetadata().withName(name).endMetadata()
            .withNewStatus()
                .withPhase(phase)
                .withReason("Failed".equals(phase) ? "ErrImagePull" : null)
                .addNewCondition().withType("Ready").withStatus(ready ? "True" : "False").endCondition()
            .endStatus()
            .build();
    }

    @Test
    void testReadyPodConfirmsAvailabilityOnce() {
        gateway.handlePodEvent(Watcher.Action.ADDED, pod("media-node-1", "Pending", false));
        gateway.handlePodEvent(Watcher.Action.MODIFIED, pod("media-node-1", "Running", true));
        gateway.handlePodEvent(Watcher.Action.MODIFIED, pod("media-node-1", "Running", true));

        assertEquals(List.of("available:media-node-1"), listener.calls);
    }

    @Test
    void testDeletionOfAvailablePodConfirmsTermination() {
        gateway.handlePodEvent(Watcher.Action.MODIFIED, pod("media-node-1", "Running", true));
        gateway.handlePodEvent(Watcher.Action.DELETED, pod("media-node-1", "Running", true));

        assertEquals(List.of("available:media-node-1", "terminated:media-node-1"), listener.calls);
    }

    @Test
    void testPodDeletedBeforeReadyAbortsLaunch() {
        gateway.handlePodEvent(Watcher.Action.ADDED, pod("media-node-2", "Pending", false));
        gateway.handlePodEvent(Watcher.Action.DELETED, pod("media-node-2", "Pending", false));

        assertEquals(List.of("aborted:media-node-2"), listener.calls);
    }

    @Test
    void testDeletionAfterRequestedTerminationConfirmsIt() {
        StepVerifier.create(gateway.requestTermination("kms-1"))
            .expectError(ProvisioningFailureException.class)
            .verify(Duration.ofSeconds(30));

        gateway.handlePodEvent(Watcher.Action.DELETED, pod("kms-1", "Running", false));

        assertEquals(List.of("terminated:kms-1"), listener.calls);
    }

    @Test
    void testDroppedAdoptedNodeIsRemovedWhenItsPodIsDeleted() {
        VirtualTimeScheduler scheduler = VirtualTimeScheduler.create();
        MediaNodeManager manager = new MediaNodeManager(TestConfigs.defaults(), gateway,
            new RecordingEventPublisher(), new SimpleMeterRegistry(), scheduler);
        gateway.attach(manager);
        try {
            MediaNode adopted = manager.adoptMediaNode("kms-1");
            manager.mediaNodeUsageRegistration(adopted, 0, manager.getMediaNodes());
            manager.mediaNodeUsageDeregistration(adopted, 0);
            manager.dropIdleMediaNode("kms-1");
            assertTrue(manager.isTerminating("kms-1"));

            gateway.handlePodEvent(Watcher.Action.DELETED, pod("kms-1", "Running", false));

            assertTrue(manager.getMediaNode("kms-1").isEmpty());
        } finally {
            manager.shutdown();
            scheduler.dispose();
        }
    }

    @Test
    void testFailedPodAbortsLaunch() {
        gateway.handlePodEvent(Watcher.Action.MODIFIED, pod("media-node-3", "Failed", false));

        assertEquals(List.of("aborted:media-node-3"), listener.calls);
    }

    @Test
    void testRejectedConfirmationIsNotPropagated() {
        gateway.attach(new RecordingListener() {
            @Override
            public void confirmAvailable(String mediaNodeId) {
                throw new InvalidStateTransitionException(mediaNodeId, MediaNodeState.RUNNING, "PROVISIONING_CONFIRMED");
            }
        });

        gateway.handlePodEvent(Watcher.Action.MODIFIED, pod("media-node-4", "Running", true));
    }

    @Test
    void testUnreachableApiServerFailsLaunch() {
        StepVerifier.create(gateway.requestLaunch())
            .expectError(ProvisioningFailureException.class)
            .verify(Duration.ofSeconds(30));
    }

    @Test
    void testPodStatusPredicates() {
        assertTrue(KubernetesProvisioningGateway.isPodReady(pod("p", "Running", true)));
        assertFalse(KubernetesProvisioningGateway.isPodReady(pod("p", "Running", false)));
        assertFalse(KubernetesProvisioningGateway.isPodReady(new PodBuilder().withNewMetadata().withName("p").endMetadata().build()));
        assertTrue(KubernetesProvisioningGateway.isPodFailed(pod("p", "Failed", false)));
        assertFalse(KubernetesProvisioningGateway.isPodFailed(pod("p", "Succeeded", false)));
    }

    private static class RecordingListener implements ProvisioningListener {
        final List<String> calls = new CopyOnWriteArrayList<>();

        @Override
        public void confirmAvailable(String mediaNodeId) {
            calls.add("available:" + mediaNodeId);
        }

        @Override
        public void abortLaunch(String mediaNodeId, String reason) {
            calls.add("aborted:" + mediaNodeId);
        }

        @Override
        public void confirmTerminated(String mediaNodeId) {
            calls.add("terminated:" + mediaNodeId);
        }

        @Override
        public void terminationFailed(String mediaNodeId, String reason) {
            calls.add("termination-failed:" + mediaNodeId);
        }
    }
}
