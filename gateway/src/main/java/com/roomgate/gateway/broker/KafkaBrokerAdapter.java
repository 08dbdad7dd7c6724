package com.roomgate.gateway.broker;

import com.roomgate.core.msg.EnvelopeCodec;
import com.roomgate.core.msg.MessageEnvelope;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Kafka broker over a single broadcast topic.
 * <p>
 * Logical topics contain characters Kafka topic names do not allow, so every envelope goes to
 * one Kafka topic with the logical topic as the record key. Each gateway process consumes the
 * whole topic with its own consumer group ({@code gateway-<processId>}) and dispatches records
 * to the local handlers registered for the key. Subscribing is therefore purely local.
 * </p>
 */
public class KafkaBrokerAdapter implements BrokerAdapter {
    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerAdapter.class);

    private static final int DEFAULT_PARTITIONS = 1;
    private static final short REPLICATION_FACTOR = 1;

    private final String bootstrapServers;
    private final String kafkaTopic;
    private final String processId;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private KafkaSender<String, String> sender;
    private AdminClient adminClient;
    private Disposable consumer;

    public KafkaBrokerAdapter(String bootstrapServers, String kafkaTopic, String processId) {
        this.bootstrapServers = bootstrapServers;
        this.kafkaTopic = kafkaTopic;
        this.processId = processId;
    }

    /**
     * Creates the producer and admin client, ensures the broadcast topic exists and starts
     * this process's consumer.
     *
     * @return Mono completing when the consumer is started
     */
    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
                Map<String, Object> producerProps = new HashMap<>();
                producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
                producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
                producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
                producerProps.put(ProducerConfig.ACKS_CONFIG, "1");
                producerProps.put(ProducerConfig.LINGER_MS_CONFIG, 5);
                sender = KafkaSender.create(SenderOptions.create(producerProps));

                Map<String, Object> adminProps = new HashMap<>();
                adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
                adminClient = AdminClient.create(adminProps);
                log.info("Kafka producer and admin client initialized: {}", bootstrapServers);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then(Mono.defer(() -> createTopicIfNotExists(kafkaTopic)))
            .doOnSuccess(v -> startConsumer());
    }

    private void startConsumer() {
        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "gateway-" + processId);
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

        ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(kafkaTopic));

        consumer = KafkaReceiver.create(receiverOptions)
            .receive()
            .doOnNext(this::onRecord)
            .onErrorContinue((err, obj) -> log.error("Error in Kafka broker consumer loop", err))
            .subscribe();
        log.info("Process {} consuming Kafka topic {}", processId, kafkaTopic);
    }

    private void onRecord(ReceiverRecord<String, String> record) {
        try {
            String topic = record.key();
            if (topic == null || !registry.hasHandlers(topic)) {
                return;
            }
            MessageEnvelope envelope = EnvelopeCodec.decode(record.value());
            if (envelope == null) {
                log.warn("Ignoring invalid Kafka record for topic {} at offset {}", topic, record.offset());
                return;
            }
            registry.dispatch(topic, envelope);
        } finally {
            record.receiverOffset().acknowledge();
        }
    }

    @Override
    public Mono<Void> publish(String topic, MessageEnvelope envelope) {
        if (sender == null) {
            return Mono.error(new IllegalStateException("Kafka broker is not connected"));
        }
        return Mono.fromCallable(() -> EnvelopeCodec.encode(envelope))
            .flatMap(json -> sender.send(Mono.just(SenderRecord.create(
                    new ProducerRecord<>(kafkaTopic, topic, json), envelope.getId())))
                .next())
            .doOnNext(result -> log.debug("Published envelope {} for {} at offset {}",
                result.correlationMetadata(), topic,
                result.recordMetadata() != null ? result.recordMetadata().offset() : -1))
            .then();
    }

    @Override
    public Mono<Disposable> subscribe(String topic, Consumer<MessageEnvelope> handler) {
        return Mono.fromSupplier(() -> registry.add(topic, handler,
            () -> log.debug("No more handlers for Kafka key {}", topic)));
    }

    @Override
    public Mono<Void> unsubscribe(String topic) {
        return Mono.fromRunnable(() -> registry.removeAll(topic));
    }

    /**
     * Creates a Kafka topic if it doesn't already exist.
     *
     * @param topicName Topic to create
     * @return Mono completing when topic is created or already exists
     */
    private Mono<Void> createTopicIfNotExists(String topicName) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR);

                    return adminClient.createTopics(Collections.singleton(
                            new NewTopic(topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error instanceof TopicExistsException || error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
                registry.clear();
                if (consumer != null) {
                    consumer.dispose();
                }
                if (sender != null) {
                    sender.close();
                }
                if (adminClient != null) {
                    adminClient.close();
                }
                log.info("Kafka broker stopped");
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }
}
