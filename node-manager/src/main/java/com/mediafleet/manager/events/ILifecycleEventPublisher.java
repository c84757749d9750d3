package com.mediafleet.manager.events;

import com.mediafleet.core.msg.ControlMessages;
import reactor.core.publisher.Mono;

/**
 * Interface for publishing lifecycle transitions (Dependency Inversion Principle).
 */
public interface ILifecycleEventPublisher {
    Mono<Void> publishTransition(ControlMessages.LifecycleTransition transition);
    void close();
}
