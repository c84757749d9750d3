package com.mediafleet.manager.provisioning;

import reactor.core.publisher.Mono;

/**
 * Interface to the system that launches and terminates media node instances
 * (Dependency Inversion Principle).
 * <p>
 * Requests are asynchronous: completion of the returned Mono only means the request
 * was accepted. Availability, launch aborts and terminations are reported later
 * through the {@link ProvisioningListener}.
 * </p>
 */
public interface IProvisioningGateway {

    /**
     * Requests a new media node.
     *
     * @return Mono of the id the new node will be known by
     */
    Mono<String> requestLaunch();

    /**
     * Requests termination of a media node.
     */
    Mono<Void> requestTermination(String mediaNodeId);

    /**
     * Registers the listener that receives confirmations. Called once at startup.
     */
    void subscribe(ProvisioningListener listener);

    void close();
}
