package com.mediafleet.manager.events;

import com.mediafleet.core.msg.ControlMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Publisher used when event streaming is disabled: transitions only go to the log.
 */
public class LoggingLifecycleEventPublisher implements ILifecycleEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(LoggingLifecycleEventPublisher.class);

    @Override
    public Mono<Void> publishTransition(ControlMessages.LifecycleTransition transition) {
        return Mono.fromRunnable(() -> log.debug("Lifecycle transition: node={}, {} -> {} ({})",
            transition.getNodeId(), transition.getFrom(), transition.getTo(), transition.getEvent()));
    }

    @Override
    public void close() {
        // Nothing to release
    }
}
