package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.model.MediaNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpMediaNodeManagerTest {

    private final IMediaNodeManager manager = new NoOpMediaNodeManager();

    @Test
    void testUsageEventsAreIgnored() {
        MediaNode node = MediaNode.adopted("kms-1", 0);

        manager.start();
        manager.mediaNodeUsageRegistration(node, 1, List.of(node));
        manager.mediaNodeUsageDeregistration(node, 2);
        // a second deregistration would underflow in the real manager
        manager.mediaNodeUsageDeregistration(node, 3);
        manager.dropIdleMediaNode("kms-1");
        manager.shutdown();

        assertTrue(manager.getMediaNodes().isEmpty());
        assertTrue(manager.getMediaNode("kms-1").isEmpty());
    }

    @Test
    void testEveryNodeReportsRunning() {
        assertTrue(manager.isRunning("any"));
        assertFalse(manager.isLaunching("any"));
        assertFalse(manager.isWaitingIdleToTerminate("any"));
        assertFalse(manager.isTerminating("any"));
        assertFalse(manager.isCanceled("any"));
    }
}
