package com.example.retrievalservice.worker;

import com.example.common.events.RetrievalRequestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for retrieval requests. One record at a time, see KafkaConsumerConfig.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "retrieval.worker.enabled", havingValue = "true", matchIfMissing = true)
public class RetrievalRequestConsumer {

    private final RetrievalWorker worker;

    @KafkaListener(
        topics = "${retrieval.queue.topic:retrieval.requests}",
        groupId = "${spring.kafka.consumer.group-id:retrieval-worker}",
        containerFactory = "retrievalKafkaListenerContainerFactory"
    )
    public void handleRetrievalRequested(RetrievalRequestedEvent event, Acknowledgment ack) {
        JobOutcome outcome = worker.process(event, ack);
        log.info("Finished retrieval request: jobId={}, outcome={}", event.getJobId(), outcome);
    }
}
