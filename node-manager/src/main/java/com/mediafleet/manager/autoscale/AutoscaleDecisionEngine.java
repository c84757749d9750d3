package com.mediafleet.manager.autoscale;

import com.mediafleet.core.error.ProvisioningFailureException;
import com.mediafleet.core.metrics.MetricsNames;
import com.mediafleet.core.metrics.MetricsTags;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.model.MediaNodeState;
import com.mediafleet.core.model.ScalingDecision;
import com.mediafleet.manager.config.ManagerConfig;
import com.mediafleet.manager.provisioning.IProvisioningGateway;
import com.mediafleet.manager.registry.MediaNodeRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Decides, after each session registration, whether another media node must be launched.
 * <p>
 * Policy:
 * <pre>
 *   spare  = sum over RUNNING and LAUNCHING nodes of max(0, sessionsPerNode - usage)
 *   launch = spare &lt; minSpareSessions
 *            and no node is LAUNCHING and no launch request is in flight
 *            and live nodes &lt; maxNodes
 * </pre>
 * </p>
 * <p>
 * At most one launch is outstanding at a time, so one demand spike never launches
 * duplicate nodes. The in-flight guard covers the gap between the request and the
 * LAUNCHING record appearing in the registry.
 * </p>
 */
public class AutoscaleDecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(AutoscaleDecisionEngine.class);

    private final ManagerConfig config;
    private final MediaNodeRegistry registry;
    private final IProvisioningGateway gateway;
    private final Scheduler scheduler;
    private final Consumer<MediaNode> onLaunched;

    private final AtomicBoolean launchInFlight = new AtomicBoolean(false);

    private final Counter launchDecisions;
    private final Counter noLaunchDecisions;
    private final Counter launchesRequested;
    private final Counter launchesFailed;

    public AutoscaleDecisionEngine(ManagerConfig config,
                                   MediaNodeRegistry registry,
                                   IProvisioningGateway gateway,
                                   Scheduler scheduler,
                                   MeterRegistry meterRegistry,
                                   Consumer<MediaNode> onLaunched) {
        this.config = config;
        this.registry = registry;
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.onLaunched = onLaunched;

        launchDecisions = Counter.builder(MetricsNames.SCALING_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "launch")
                .register(meterRegistry);

        noLaunchDecisions = Counter.builder(MetricsNames.SCALING_DECISIONS_TOTAL)
                .tag(MetricsTags.ACTION, "none")
                .register(meterRegistry);

        launchesRequested = Counter.builder(MetricsNames.LAUNCH_REQUESTS_TOTAL)
                .tag(MetricsTags.OUTCOME, "requested")
                .register(meterRegistry);

        launchesFailed = Counter.builder(MetricsNames.LAUNCH_REQUESTS_TOTAL)
                .tag(MetricsTags.OUTCOME, "failed")
                .register(meterRegistry);
    }

    /**
     * Evaluates the fleet and, if needed, hands a launch request to the gateway.
     * <p>
     * Returns as soon as the decision is made; the launch itself completes
     * asynchronously and inserts a LAUNCHING record when the gateway accepts it.
     * </p>
     *
     * @param fleet fleet view to evaluate; not mutated
     * @return the decision
     */
    public ScalingDecision evaluate(Collection<MediaNode> fleet) {
        long now = scheduler.now(TimeUnit.MILLISECONDS);

        int spare = fleet.stream()
                .filter(node -> node.getState() == MediaNodeState.RUNNING || node.getState() == MediaNodeState.LAUNCHING)
                .mapToInt(node -> node.spareCapacity(config.getSessionsPerNode()))
                .sum();

        if (spare >= config.getMinSpareSessions()) {
            return none(spare, "Spare capacity sufficient", now);
        }

        boolean launching = fleet.stream().anyMatch(node -> node.getState() == MediaNodeState.LAUNCHING)
                || registry.count(MediaNodeState.LAUNCHING) > 0;
        if (launching) {
            return none(spare, "A media node is already launching", now);
        }

        long liveNodes = registry.snapshot().stream()
                .filter(node -> node.getState() != MediaNodeState.TERMINATING && node.getState() != MediaNodeState.CANCELED)
                .count();
        if (liveNodes >= config.getMaxNodes()) {
            log.warn("Spare capacity {} below {} but fleet is at its limit of {} nodes",
                    spare, config.getMinSpareSessions(), config.getMaxNodes());
            return none(spare, "Fleet at maximum size", now);
        }

        if (!launchInFlight.compareAndSet(false, true)) {
            return none(spare, "Launch request already in flight", now);
        }
        // a launch that finished between the check above and the guard left a LAUNCHING record
        if (registry.count(MediaNodeState.LAUNCHING) > 0) {
            launchInFlight.set(false);
            return none(spare, "A media node is already launching", now);
        }

        String reason = String.format("Spare capacity %d below threshold %d (nodes=%d)",
                spare, config.getMinSpareSessions(), liveNodes);
        log.info("Autoscale decision: LAUNCH, reason={}", reason);
        launchDecisions.increment();

        launch()
                .subscribe(
                        node -> { },
                        err -> log.warn("Launch request failed, will retry on a later registration: {}", err.getMessage())
                );

        return ScalingDecision.builder()
                .action(ScalingDecision.Action.LAUNCH)
                .spareCapacity(spare)
                .reason(reason)
                .timestampMs(now)
                .build();
    }

    /**
     * @return true while a launch request awaits the gateway's answer
     */
    public boolean isLaunchInFlight() {
        return launchInFlight.get();
    }

    private Mono<MediaNode> launch() {
        // a gateway that throws on the call becomes an error signal
        return Mono.defer(gateway::requestLaunch)
                .switchIfEmpty(Mono.error(() -> new ProvisioningFailureException(null, "Gateway returned no media node id")))
                .map(mediaNodeId -> {
                    MediaNode node = MediaNode.launching(mediaNodeId, scheduler.now(TimeUnit.MILLISECONDS));
                    if (!registry.putIfAbsent(node)) {
                        throw new ProvisioningFailureException(mediaNodeId,
                                "Gateway returned id " + mediaNodeId + " which is already registered");
                    }
                    return node;
                })
                .doOnSuccess(node -> {
                    launchesRequested.increment();
                    log.info("Media node {} launching", node.getId());
                    onLaunched.accept(node);
                })
                .onErrorMap(err -> !(err instanceof ProvisioningFailureException),
                        err -> new ProvisioningFailureException(null, "Launch request failed: " + err.getMessage(), err))
                .doOnError(err -> launchesFailed.increment())
                .doFinally(signal -> launchInFlight.set(false));
    }

    private ScalingDecision none(int spare, String reason, long now) {
        noLaunchDecisions.increment();
        return ScalingDecision.builder()
                .action(ScalingDecision.Action.NONE)
                .spareCapacity(spare)
                .reason(reason)
                .timestampMs(now)
                .build();
    }
}
