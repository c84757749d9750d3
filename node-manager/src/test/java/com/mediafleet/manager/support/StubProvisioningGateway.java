package com.mediafleet.manager.support;

import com.mediafleet.manager.provisioning.IProvisioningGateway;
import com.mediafleet.manager.provisioning.ProvisioningListener;
import lombok.Getter;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory gateway: hands out sequential ids and records termination requests.
 * Confirmations are driven by the test through {@link #getListener()}.
 */
public class StubProvisioningGateway implements IProvisioningGateway {

    private final AtomicInteger launchSequence = new AtomicInteger();
    private final AtomicInteger terminationFailuresLeft = new AtomicInteger();

    @Getter
    private final List<String> launched = new CopyOnWriteArrayList<>();
    @Getter
    private final List<String> terminationRequests = new CopyOnWriteArrayList<>();

    @Getter
    private volatile ProvisioningListener listener;
    @Getter
    private volatile boolean closed;

    private volatile boolean failLaunches;
    private volatile boolean throwOnNextLaunchCall;
    private volatile boolean holdLaunches;
    private volatile Sinks.One<String> heldLaunch;

    @Override
    public Mono<String> requestLaunch() {
        if (throwOnNextLaunchCall) {
            throwOnNextLaunchCall = false;
            throw new IllegalStateException("client not ready");
        }
        return Mono.defer(() -> {
            if (failLaunches) {
                return Mono.error(new IllegalStateException("instance quota exceeded"));
            }
            String id = "media-node-" + launchSequence.incrementAndGet();
            launched.add(id);
            if (holdLaunches) {
                Sinks.One<String> sink = Sinks.one();
                heldLaunch = sink;
                return sink.asMono().thenReturn(id);
            }
            return Mono.just(id);
        });
    }

    @Override
    public Mono<Void> requestTermination(String mediaNodeId) {
        return Mono.defer(() -> {
            terminationRequests.add(mediaNodeId);
            if (terminationFailuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                return Mono.error(new IllegalStateException("cloud API unavailable"));
            }
            return Mono.empty();
        });
    }

    @Override
    public void subscribe(ProvisioningListener listener) {
        this.listener = listener;
    }

    @Override
    public void close() {
        closed = true;
    }

    public void failLaunches(boolean fail) {
        this.failLaunches = fail;
    }

    /**
     * The next {@link #requestLaunch()} throws instead of returning a Mono.
     */
    public void throwOnNextLaunchCall() {
        this.throwOnNextLaunchCall = true;
    }

    /**
     * Launch requests stay pending until {@link #releaseHeldLaunch()}.
     */
    public void holdLaunches(boolean hold) {
        this.holdLaunches = hold;
    }

    public void releaseHeldLaunch() {
        heldLaunch.tryEmitValue("released");
    }

    public void failNextTerminations(int count) {
        terminationFailuresLeft.set(count);
    }

    public long terminationRequestsFor(String mediaNodeId) {
        return terminationRequests.stream().filter(mediaNodeId::equals).count();
    }
}
