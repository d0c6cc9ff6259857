package com.meshgate.gateway.kafka;

import com.meshgate.core.msg.GatewayEvent;
import com.meshgate.core.msg.Topics;
import com.meshgate.core.util.JsonUtils;
import com.meshgate.gateway.config.GatewayConfig;
import com.meshgate.gateway.event.GatewayEventListener;
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
 * Best-effort broadcast of gateway events to {@value Topics#GATEWAY_EVENTS}, keyed by service name.
 * <p>
 * Failures are logged and dropped; no gateway decision depends on delivery.
 * </p>
 */
public class KafkaEventPublisher implements IEventPublisher, GatewayEventListener {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaEventPublisher(GatewayConfig config) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, config.getNodeId());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "1");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        createTopicIfNotExists(Topics.GATEWAY_EVENTS, 4, (short) 1)
            .subscribe(null, err -> log.warn("Event topic setup failed, broadcast may be unavailable", err));
        log.info("Kafka event publisher initialized");
    }

    @Override
    public Mono<Void> publish(GatewayEvent event) {
        ProducerRecord<String, String> record = new ProducerRecord<>(
            Topics.GATEWAY_EVENTS,
            event.getServiceName(), // partition by service
            JsonUtils.writeValueAsString(event)
        );

        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .doOnSuccess(result -> log.debug("Published {} for {}",
                event.getClass().getSimpleName(), event.getServiceName()))
            .then();
    }

    @Override
    public void onEvent(GatewayEvent event) {
        publish(event).subscribe(null, err -> log.warn("Failed to broadcast {} for {}: {}",
            event.getClass().getSimpleName(), event.getServiceName(), err.toString()));
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }
                log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                    topicName, partitions, replicationFactor);
                NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);
                return Mono.fromFuture(() -> adminClient.createTopics(Collections.singleton(newTopic))
                    .all()
                    .toCompletionStage()
                    .toCompletableFuture());
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
        log.info("Kafka event publisher closed");
    }
}
