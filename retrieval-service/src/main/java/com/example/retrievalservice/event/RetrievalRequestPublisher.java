package com.example.retrievalservice.event;

import com.example.common.events.RetrievalRequestedEvent;
import com.example.retrievalservice.exception.QueuePublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes retrieval requests to the work queue.
 *
 * The send is awaited so the caller only reports acceptance once the broker has the
 * message (acks=all, see KafkaProducerConfig).
 */
@Slf4j
@Component
public class RetrievalRequestPublisher {

    private final KafkaTemplate<String, RetrievalRequestedEvent> kafkaTemplate;
    private final String topic;
    private final long sendTimeoutSeconds;

    public RetrievalRequestPublisher(
            KafkaTemplate<String, RetrievalRequestedEvent> kafkaTemplate,
            @Value("${retrieval.queue.topic:retrieval.requests}") String topic,
            @Value("${retrieval.queue.send-timeout-seconds:10}") long sendTimeoutSeconds) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendTimeoutSeconds = sendTimeoutSeconds;
    }

    /**
     * @throws QueuePublishException if the broker did not confirm the message
     */
    public void publish(RetrievalRequestedEvent event) {
        log.info("Publishing RetrievalRequestedEvent: jobId={}, path={}", event.getJobId(), event.getSdaPath());

        try {
            kafkaTemplate.send(topic, event.getJobId(), event).get(sendTimeoutSeconds, TimeUnit.SECONDS);
            log.info("RetrievalRequestedEvent published successfully: jobId={}", event.getJobId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueuePublishException(event.getJobId(), e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to publish RetrievalRequestedEvent: jobId={}", event.getJobId(), e);
            throw new QueuePublishException(event.getJobId(), e);
        } catch (RuntimeException e) {
            log.error("Error publishing RetrievalRequestedEvent: jobId={}", event.getJobId(), e);
            throw new QueuePublishException(event.getJobId(), e);
        }
    }
}
