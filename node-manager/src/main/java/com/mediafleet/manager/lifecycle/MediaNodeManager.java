package com.mediafleet.manager.lifecycle;

import com.mediafleet.core.error.InvalidStateTransitionException;
import com.mediafleet.core.error.MediaNodeException;
import com.mediafleet.core.error.NodeNotFoundException;
import com.mediafleet.core.error.UsageUnderflowException;
import com.mediafleet.core.metrics.MetricsNames;
import com.mediafleet.core.metrics.MetricsTags;
import com.mediafleet.core.model.LifecycleEvent;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.model.MediaNodeState;
import com.mediafleet.core.model.ScalingDecision;
import com.mediafleet.core.msg.ControlMessages;
import com.mediafleet.core.util.JitterBackoff;
import com.mediafleet.manager.autoscale.AutoscaleDecisionEngine;
import com.mediafleet.manager.config.ManagerConfig;
import com.mediafleet.manager.events.ILifecycleEventPublisher;
import com.mediafleet.manager.idle.IdleReaper;
import com.mediafleet.manager.provisioning.IProvisioningGateway;
import com.mediafleet.manager.provisioning.ProvisioningListener;
import com.mediafleet.manager.registry.MediaNodeRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static com.mediafleet.core.model.MediaNodeState.*;

/**
 * Lifecycle manager for the media node fleet.
 * <p>
 * Responsibilities:
 * - Track session usage per node and drive the lifecycle state machine
 * - Arm and cancel idle deadlines as usage hits and leaves zero
 * - Ask the autoscale engine for a launch after every registration
 * - Apply provisioning confirmations and retry failed terminations
 * </p>
 * <p>
 * Every read-modify-write of a node runs inside {@link MediaNodeRegistry#update}, the
 * node's exclusive section; idle deadlines enter the same section when they fire, so
 * a registration racing a deadline is resolved by whichever gets the lock first.
 * Gateway calls and event publishing happen after the lock is released.
 * </p>
 * <p>
 * The scheduler is the manager's clock and runs idle deadlines and retries.
 * </p>
 */
public class MediaNodeManager implements IMediaNodeManager, ProvisioningListener {
    private static final Logger log = LoggerFactory.getLogger(MediaNodeManager.class);

    private static final String MDC_NODE_ID = "mediaNodeId";

    private final ManagerConfig config;
    private final IProvisioningGateway gateway;
    private final ILifecycleEventPublisher eventPublisher;
    private final Scheduler scheduler;

    @Getter
    private final MediaNodeRegistry registry;
    @Getter
    private final LifecycleStateMachine stateMachine;
    @Getter
    private final IdleReaper idleReaper;
    @Getter
    private final AutoscaleDecisionEngine autoscaleEngine;

    // Pending termination retry or cancellation finalization, at most one per node
    private final Map<String, Disposable> followUps = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean closed;

    private final Counter registrations;
    private final Counter deregistrations;
    private final Counter invalidTransitions;
    private final Counter usageUnderflows;
    private final Counter nodesNotFound;
    private final Counter gracePeriodTerminations;
    private final Counter dropTerminations;
    private final Counter terminationRetries;
    private final Counter terminationEscalations;
    private final Counter publishFailures;

    public MediaNodeManager(ManagerConfig config,
                            IProvisioningGateway gateway,
                            ILifecycleEventPublisher eventPublisher,
                            MeterRegistry meterRegistry,
                            Scheduler scheduler) {
        this.config = config;
        this.gateway = gateway;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;

        this.registry = new MediaNodeRegistry(meterRegistry);
        this.stateMachine = new LifecycleStateMachine(registry);
        this.idleReaper = new IdleReaper(scheduler, config.getIdleGracePeriod(), this::onIdleDeadline);
        this.autoscaleEngine = new AutoscaleDecisionEngine(config, registry, gateway, scheduler, meterRegistry,
            node -> publish(null, node, LAUNCHING, LifecycleEvent.LAUNCH_REQUESTED));

        registrations = Counter.builder(MetricsNames.USAGE_REGISTRATIONS_TOTAL).register(meterRegistry);
        deregistrations = Counter.builder(MetricsNames.USAGE_DEREGISTRATIONS_TOTAL).register(meterRegistry);
        invalidTransitions = violationCounter(meterRegistry, "invalid_state_transition");
        usageUnderflows = violationCounter(meterRegistry, "usage_underflow");
        nodesNotFound = violationCounter(meterRegistry, "node_not_found");
        gracePeriodTerminations = Counter.builder(MetricsNames.IDLE_TERMINATIONS_TOTAL)
            .tag(MetricsTags.REASON, "grace_period")
            .register(meterRegistry);
        dropTerminations = Counter.builder(MetricsNames.IDLE_TERMINATIONS_TOTAL)
            .tag(MetricsTags.REASON, "drop")
            .register(meterRegistry);
        terminationRetries = Counter.builder(MetricsNames.TERMINATION_RETRIES_TOTAL).register(meterRegistry);
        terminationEscalations = Counter.builder(MetricsNames.TERMINATION_ESCALATIONS_TOTAL).register(meterRegistry);
        publishFailures = Counter.builder(MetricsNames.EVENT_PUBLISH_FAILURES_TOTAL)
            .tag(MetricsTags.TOPIC, "lifecycle")
            .register(meterRegistry);
    }

    // ========== Usage protocol ==========

    @Override
    public void mediaNodeUsageRegistration(MediaNode node, long timeOfConnection, Collection<MediaNode> existingNodes) {
        String id = node.getId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, id)) {
            if (closed) {
                throw new IllegalStateException("Media node manager is shut down, rejecting registration on " + id);
            }

            AtomicReference<MediaNodeState> previous = new AtomicReference<>();
            MediaNode updated = guarded(() -> registry.update(id, current -> {
                if (!current.acceptsRegistrations()) {
                    throw new InvalidStateTransitionException(id, current.getState(), "session registration");
                }
                previous.set(current.getState());
                MediaNode next = current.toBuilder()
                    .usageCount(current.getUsageCount() + 1)
                    .lastUsageChangeAt(timeOfConnection)
                    .idleSince(null)
                    .build();
                if (current.getState() == WAITING_IDLE_TO_TERMINATE) {
                    next = stateMachine.transition(next, LifecycleEvent.USAGE_RESUMED);
                    idleReaper.cancel(id);
                }
                return next;
            }));

            registrations.increment();
            log.debug("Session attached to media node {} (usage={})", id, updated.getUsageCount());
            if (previous.get() != updated.getState()) {
                log.info("Media node {} is RUNNING again, idle deadline cancelled", id);
                publish(previous.get(), updated, updated.getState(), LifecycleEvent.USAGE_RESUMED);
            }

            autoscaleEngine.evaluate(fleetView(existingNodes, updated));
        }
    }

    @Override
    public void mediaNodeUsageDeregistration(MediaNode node, long timeOfDisconnection) {
        String id = node.getId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, id)) {
            AtomicLong armed = new AtomicLong(IdleReaper.NOT_ARMED);
            MediaNode updated = guarded(() -> registry.update(id, current -> {
                if (current.getUsageCount() == 0) {
                    throw new UsageUnderflowException(id);
                }
                int remaining = current.getUsageCount() - 1;
                MediaNode next = current.toBuilder()
                    .usageCount(remaining)
                    .lastUsageChangeAt(timeOfDisconnection)
                    .build();
                if (remaining == 0 && !closed) {
                    next = stateMachine.transition(next, LifecycleEvent.USAGE_REACHED_ZERO)
                        .withIdleSince(timeOfDisconnection);
                    armed.set(idleReaper.arm(id, timeOfDisconnection));
                }
                return next;
            }));

            deregistrations.increment();
            log.debug("Session detached from media node {} (usage={})", id, updated.getUsageCount());
            if (armed.get() != IdleReaper.NOT_ARMED) {
                publish(RUNNING, updated, updated.getState(), LifecycleEvent.USAGE_REACHED_ZERO);
                idleReaper.activate(id, armed.get());
            }
        }
    }

    // ========== Idle reaping ==========

    @Override
    public void dropIdleMediaNode(String mediaNodeId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            AtomicBoolean dropped = new AtomicBoolean(false);
            MediaNode updated;
            try {
                updated = registry.update(mediaNodeId, current -> {
                    if (current.getState() != WAITING_IDLE_TO_TERMINATE) {
                        return current;
                    }
                    MediaNode next = stateMachine.transition(current, LifecycleEvent.DROP_REQUESTED)
                        .withTerminationAttempts(0);
                    idleReaper.cancel(mediaNodeId);
                    dropped.set(true);
                    return next;
                });
            } catch (NodeNotFoundException e) {
                log.debug("Drop of unknown media node {} ignored", mediaNodeId);
                return;
            }

            if (!dropped.get()) {
                log.debug("Drop of media node {} ignored, state is {}", mediaNodeId, updated.getState());
                return;
            }
            dropTerminations.increment();
            log.info("Idle media node {} dropped, terminating before its grace period ends", mediaNodeId);
            publish(WAITING_IDLE_TO_TERMINATE, updated, TERMINATING, LifecycleEvent.DROP_REQUESTED);
            requestTermination(mediaNodeId);
        }
    }

    private void onIdleDeadline(String mediaNodeId, long generation) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            AtomicBoolean expired = new AtomicBoolean(false);
            MediaNode updated;
            try {
                updated = registry.update(mediaNodeId, current -> {
                    if (current.getState() != WAITING_IDLE_TO_TERMINATE || !idleReaper.complete(mediaNodeId, generation)) {
                        return current;
                    }
                    expired.set(true);
                    return stateMachine.transition(current, LifecycleEvent.GRACE_PERIOD_ELAPSED)
                        .withTerminationAttempts(0);
                });
            } catch (NodeNotFoundException e) {
                log.debug("Idle deadline for removed media node {} discarded", mediaNodeId);
                return;
            }

            if (!expired.get()) {
                log.debug("Stale idle deadline (generation {}) for media node {} discarded, state is {}",
                    generation, mediaNodeId, updated.getState());
                return;
            }
            gracePeriodTerminations.increment();
            log.info("Media node {} stayed idle for {}, terminating", mediaNodeId, config.getIdleGracePeriod());
            publish(WAITING_IDLE_TO_TERMINATE, updated, TERMINATING, LifecycleEvent.GRACE_PERIOD_ELAPSED);
            requestTermination(mediaNodeId);
        }
    }

    // ========== Provisioning confirmations ==========

    @Override
    public void confirmAvailable(String mediaNodeId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            MediaNode updated = guarded(() -> registry.update(mediaNodeId,
                current -> stateMachine.transition(current, LifecycleEvent.PROVISIONING_CONFIRMED)));
            log.info("Media node {} is RUNNING", mediaNodeId);
            publish(LAUNCHING, updated, updated.getState(), LifecycleEvent.PROVISIONING_CONFIRMED);
        }
    }

    @Override
    public void abortLaunch(String mediaNodeId, String reason) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            MediaNode updated = guarded(() -> registry.update(mediaNodeId,
                current -> stateMachine.transition(current, LifecycleEvent.PROVISIONING_ABORTED)));
            log.warn("Launch of media node {} aborted: {}", mediaNodeId, reason);
            publish(LAUNCHING, updated, updated.getState(), LifecycleEvent.PROVISIONING_ABORTED);
            scheduleFollowUp(mediaNodeId, () -> finalizeCancellation(mediaNodeId), config.getCanceledRetention());
        }
    }

    @Override
    public void confirmTerminated(String mediaNodeId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            MediaNode removed = guarded(() -> registry.remove(mediaNodeId,
                current -> stateMachine.checkRemoval(current, LifecycleEvent.TERMINATION_CONFIRMED)));
            cancelFollowUp(mediaNodeId);
            log.info("Media node {} terminated and removed from the registry", mediaNodeId);
            publish(TERMINATING, removed, null, LifecycleEvent.TERMINATION_CONFIRMED);
        }
    }

    @Override
    public void terminationFailed(String mediaNodeId, String reason) {
        retryTermination(mediaNodeId, reason);
    }

    private void finalizeCancellation(String mediaNodeId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            MediaNode removed = registry.remove(mediaNodeId,
                current -> stateMachine.checkRemoval(current, LifecycleEvent.CANCELLATION_FINALIZED));
            log.info("Canceled media node {} removed from the registry", mediaNodeId);
            publish(CANCELED, removed, null, LifecycleEvent.CANCELLATION_FINALIZED);
        } catch (MediaNodeException e) {
            log.warn("Could not finalize cancellation of media node {}: {}", mediaNodeId, e.getMessage());
        }
    }

    private void requestTermination(String mediaNodeId) {
        gateway.requestTermination(mediaNodeId)
            .subscribe(
                v -> { },
                err -> retryTermination(mediaNodeId, err.getMessage()),
                () -> log.info("Termination of media node {} requested", mediaNodeId)
            );
    }

    private void retryTermination(String mediaNodeId, String reason) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_NODE_ID, mediaNodeId)) {
            MediaNode updated;
            try {
                updated = registry.update(mediaNodeId, current -> {
                    if (current.getState() != TERMINATING) {
                        throw new InvalidStateTransitionException(mediaNodeId, current.getState(), "termination retry");
                    }
                    return current.withTerminationAttempts(current.getTerminationAttempts() + 1);
                });
            } catch (MediaNodeException e) {
                log.warn("Termination failure for media node {} ignored: {}", mediaNodeId, e.getMessage());
                return;
            }

            int failures = updated.getTerminationAttempts();
            if (failures > config.getTerminationMaxRetries()) {
                cancelFollowUp(mediaNodeId);
                terminationEscalations.increment();
                log.error("Termination of media node {} failed {} times; node left TERMINATING, operator action required. Last error: {}",
                    mediaNodeId, failures, reason);
                return;
            }
            if (closed) {
                log.warn("Manager shut down, termination of media node {} not retried: {}", mediaNodeId, reason);
                return;
            }

            Duration delay = JitterBackoff.next(failures - 1, config.getTerminationRetryBase(),
                config.getTerminationRetryMax(), config.getTerminationRetryJitter());
            terminationRetries.increment();
            log.warn("Termination of media node {} failed (attempt {} of {}): {}. Retrying in {} ms",
                mediaNodeId, failures, config.getTerminationMaxRetries() + 1, reason, delay.toMillis());
            scheduleFollowUp(mediaNodeId, () -> requestTermination(mediaNodeId), delay);
        }
    }

    private void scheduleFollowUp(String mediaNodeId, Runnable action, Duration delay) {
        Disposable.Swap slot = Disposables.swap();
        Disposable previous = followUps.put(mediaNodeId, slot);
        if (previous != null) {
            previous.dispose();
        }
        slot.update(scheduler.schedule(() -> {
            followUps.remove(mediaNodeId, slot);
            action.run();
        }, delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    int pendingFollowUpCount() {
        return followUps.size();
    }

    private void cancelFollowUp(String mediaNodeId) {
        Disposable pending = followUps.remove(mediaNodeId);
        if (pending != null) {
            pending.dispose();
        }
    }

    // ========== Fleet management ==========

    /**
     * Registers a node that is already running (e.g. statically configured) as RUNNING.
     *
     * @throws IllegalArgumentException if a record with this id exists
     */
    public MediaNode adoptMediaNode(String mediaNodeId) {
        if (closed) {
            throw new IllegalStateException("Media node manager is shut down, cannot adopt " + mediaNodeId);
        }
        MediaNode node = MediaNode.adopted(mediaNodeId, now());
        if (!registry.putIfAbsent(node)) {
            throw new IllegalArgumentException("Media node " + mediaNodeId + " is already registered");
        }
        log.info("Adopted running media node {}", mediaNodeId);
        publish(null, node, RUNNING, LifecycleEvent.ADOPTED);
        return node;
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Media node manager already started");
            return;
        }
        gateway.subscribe(this);
        if (config.getAdoptedMediaNodes() != null) {
            config.getAdoptedMediaNodes().forEach(this::adoptMediaNode);
        }
        ScalingDecision decision = autoscaleEngine.evaluate(registry.snapshot());
        log.info("Media node manager started with {} nodes, initial autoscale decision: {} ({})",
            registry.size(), decision.getAction(), decision.getReason());
    }

    @Override
    public void shutdown() {
        closed = true;
        idleReaper.close();
        followUps.values().forEach(Disposable::dispose);
        followUps.clear();
        log.info("Media node manager shut down, {} nodes left in the registry", registry.size());
    }

    // ========== Queries ==========

    @Override
    public boolean isLaunching(String mediaNodeId) {
        return stateMachine.isLaunching(mediaNodeId);
    }

    @Override
    public boolean isCanceled(String mediaNodeId) {
        return stateMachine.isCanceled(mediaNodeId);
    }

    @Override
    public boolean isRunning(String mediaNodeId) {
        return stateMachine.isRunning(mediaNodeId);
    }

    @Override
    public boolean isTerminating(String mediaNodeId) {
        return stateMachine.isTerminating(mediaNodeId);
    }

    @Override
    public boolean isWaitingIdleToTerminate(String mediaNodeId) {
        return stateMachine.isWaitingIdleToTerminate(mediaNodeId);
    }

    @Override
    public Optional<MediaNode> getMediaNode(String mediaNodeId) {
        return registry.get(mediaNodeId);
    }

    @Override
    public List<MediaNode> getMediaNodes() {
        return registry.snapshot();
    }

    // ========== Helpers ==========

    private <T> T guarded(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (InvalidStateTransitionException e) {
            invalidTransitions.increment();
            log.warn("Rejected: {}", e.getMessage());
            throw e;
        } catch (UsageUnderflowException e) {
            usageUnderflows.increment();
            log.warn("Rejected: {}", e.getMessage());
            throw e;
        } catch (NodeNotFoundException e) {
            nodesNotFound.increment();
            log.warn("Rejected: {}", e.getMessage());
            throw e;
        }
    }

    private void publish(MediaNodeState from, MediaNode node, MediaNodeState to, LifecycleEvent event) {
        ControlMessages.LifecycleTransition transition = ControlMessages.LifecycleTransition.builder()
            .nodeId(node.getId())
            .from(from)
            .to(to)
            .event(event)
            .usageCount(node.getUsageCount())
            .ts(now())
            .build();

        eventPublisher.publishTransition(transition)
            .subscribe(
                v -> { },
                err -> {
                    publishFailures.increment();
                    log.warn("Failed to publish {} for media node {}: {}", event, node.getId(), err.getMessage());
                }
            );
    }

    private static List<MediaNode> fleetView(Collection<MediaNode> existingNodes, MediaNode updated) {
        Map<String, MediaNode> byId = new LinkedHashMap<>();
        if (existingNodes != null) {
            existingNodes.forEach(node -> byId.put(node.getId(), node));
        }
        byId.put(updated.getId(), updated);
        return new ArrayList<>(byId.values());
    }

    private static Counter violationCounter(MeterRegistry meterRegistry, String kind) {
        return Counter.builder(MetricsNames.CONTRACT_VIOLATIONS_TOTAL)
            .tag(MetricsTags.KIND, kind)
            .register(meterRegistry);
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
