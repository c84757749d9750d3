package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.model.MediaNode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stand-in for deployments whose media nodes are managed outside this service.
 * <p>
 * Ignores usage events and reports every node as running, so routing can use any
 * node it knows about.
 * </p>
 */
public class NoOpMediaNodeManager implements IMediaNodeManager {

    @Override
    public void mediaNodeUsageRegistration(MediaNode node, long timeOfConnection, Collection<MediaNode> existingNodes) {
    }

    @Override
    public void mediaNodeUsageDeregistration(MediaNode node, long timeOfDisconnection) {
    }

    @Override
    public void dropIdleMediaNode(String mediaNodeId) {
    }

    @Override
    public boolean isLaunching(String mediaNodeId) {
        return false;
    }

    @Override
    public boolean isCanceled(String mediaNodeId) {
        return false;
    }

    @Override
    public boolean isRunning(String mediaNodeId) {
        return true;
    }

    @Override
    public boolean isTerminating(String mediaNodeId) {
        return false;
    }

    @Override
    public boolean isWaitingIdleToTerminate(String mediaNodeId) {
        return false;
    }

    @Override
    public Optional<MediaNode> getMediaNode(String mediaNodeId) {
        return Optional.empty();
    }

    @Override
    public List<MediaNode> getMediaNodes() {
        return List.of();
    }

    @Override
    public void start() {
    }

    @Override
    public void shutdown() {
    }
}
