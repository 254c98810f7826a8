package com.example.retrievalservice.config;

import com.example.common.events.RetrievalRequestedEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer configuration for the retrieval worker.
 *
 * Consumer configuration:
 * - One listener thread, one record per poll: a process handles a single retrieval at a time
 * - Auto commit off, offsets committed by the worker as soon as it acknowledges
 * - max.poll.interval.ms covers a full archive pull so the group never rebalances mid-job
 * - Records that fail to deserialize are logged and skipped, never retried
 *
 * Only enabled when retrieval.worker.enabled=true (default)
 */
@Slf4j
@Configuration
@EnableKafka
@ConditionalOnProperty(name = "retrieval.worker.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:retrieval-worker}")
    private String groupId;

    @Value("${retrieval.queue.max-poll-interval-ms:14400000}")
    private int maxPollIntervalMs;

    @Bean
    public ConsumerFactory<String, RetrievalRequestedEvent> retrievalRequestConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        props.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class.getName());
        props.put(JsonDeserializer.VALUE_DEFAULT_TYPE, RetrievalRequestedEvent.class.getName());
        props.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        props.put(JsonDeserializer.TRUSTED_PACKAGES, "com.example.common.events");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, maxPollIntervalMs);

        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, RetrievalRequestedEvent>
            retrievalKafkaListenerContainerFactory() {

        ConcurrentKafkaListenerContainerFactory<String, RetrievalRequestedEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(retrievalRequestConsumerFactory());
        factory.setConcurrency(1);
        factory.getContainerProperties().setPollTimeout(3000);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);

        // no retries: a failed retrieval is reported to the requester, not redelivered
        factory.setCommonErrorHandler(new DefaultErrorHandler(
                (record, exception) -> log.error("Skipping record at offset {}: {}",
                        record.offset(), exception.getMessage(), exception),
                new FixedBackOff(0L, 0L)
        ));

        return factory;
    }
}
