package com.mediafleet.manager.kafka;

import com.mediafleet.core.msg.ControlMessages;
import com.mediafleet.core.msg.Topics;
import com.mediafleet.core.util.JsonUtils;
import com.mediafleet.manager.config.ManagerConfig;
import com.mediafleet.manager.events.ILifecycleEventPublisher;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Publishes lifecycle transitions to {@link Topics#CONTROL_LIFECYCLE}, keyed by media node id.
 */
public class KafkaLifecycleEventPublisher implements ILifecycleEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaLifecycleEventPublisher.class);

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaLifecycleEventPublisher(ManagerConfig config) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        SenderOptions<String, String> senderOptions = SenderOptions.create(producerProps);
        this.sender = KafkaSender.create(senderOptions);

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        createTopicIfNotExists(Topics.CONTROL_LIFECYCLE, 4, (short) 1)
            .subscribe(
                v -> { },
                err -> log.error("Lifecycle topic setup failed; transitions will not be published until it exists", err)
            );
        log.info("Kafka lifecycle event publisher initialized");
    }

    @Override
    public Mono<Void> publishTransition(ControlMessages.LifecycleTransition transition) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.CONTROL_LIFECYCLE,
            transition.getNodeId(), // partition by nodeId
            JsonUtils.writeValueAsString(transition)
        );

        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .doOnSuccess(result -> log.debug("Published lifecycle transition: nodeId={}, {} -> {}",
                transition.getNodeId(), transition.getFrom(), transition.getTo()))
            .doOnError(err -> log.error("Failed to publish lifecycle transition for {}", transition.getNodeId(), err))
            .then();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(newTopic))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        sender.close();
        adminClient.close();
        log.info("Kafka lifecycle event publisher closed");
    }
}
