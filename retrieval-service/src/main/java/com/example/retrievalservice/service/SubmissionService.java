package com.example.retrievalservice.service;

import com.example.common.events.RetrievalRequestedEvent;
import com.example.retrievalservice.dto.SubmissionResult;
import com.example.retrievalservice.entity.JobStatus;
import com.example.retrievalservice.entity.RetrievalJob;
import com.example.retrievalservice.event.RetrievalRequestPublisher;
import com.example.retrievalservice.metrics.RetrievalMetrics;
import com.example.retrievalservice.repository.RetrievalJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Submission gateway: admits, deduplicates and queues retrieval requests.
 *
 * Steps:
 * 1. Reject deny-listed requesters without touching the store or the queue
 * 2. Reject if the same requester asked for the same collection within the minimum job interval
 *    (only the most recent non-failed job counts)
 * 3. Insert the job row (status submitted)
 * 4. Publish the job to the work queue and return without waiting for the retrieval
 *
 * The insert and the publish are not atomic. A publish failure leaves a submitted row
 * that no worker will pick up; the requester can resubmit once the interval lapses.
 *
 * The duplicate check and the insert are not atomic either. Two identical submissions that
 * arrive at the same moment can both pass the check and both be queued. The worker tolerates
 * this: the second pull of the same collection finds the first one's staged file.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final RetrievalJobRepository jobRepository;
    private final RetrievalRequestPublisher publisher;
    private final DenyList denyList;
    private final RetrievalMetrics metrics;
    private final Duration minimumJobInterval;

    public SubmissionService(
            RetrievalJobRepository jobRepository,
            RetrievalRequestPublisher publisher,
            DenyList denyList,
            RetrievalMetrics metrics,
            @Value("${retrieval.queue.minimum-job-interval-minutes:360}") long minimumJobIntervalMinutes) {
        this.jobRepository = jobRepository;
        this.publisher = publisher;
        this.denyList = denyList;
        this.metrics = metrics;
        this.minimumJobInterval = Duration.ofMinutes(minimumJobIntervalMinutes);
    }

    /**
     * Submit a retrieval request.
     *
     * @param collectionPath full archive path of the requested collection
     * @param requesterEmail where notifications go
     * @param sourceIp client address, recorded for audit
     * @return accepted result carrying the job id, or a rejection with a user-facing message
     * @throws com.example.retrievalservice.exception.QueuePublishException if the job was stored but not queued
     */
    public SubmissionResult submit(String collectionPath, String requesterEmail, String sourceIp) {
        if (collectionPath == null || collectionPath.isBlank()) {
            throw new IllegalArgumentException("Collection path is required");
        }
        if (requesterEmail == null || requesterEmail.isBlank()) {
            throw new IllegalArgumentException("Requester email is required");
        }

        if (denyList.contains(requesterEmail)) {
            log.info("{} is in deny list, skip request", requesterEmail);
            metrics.recordSubmission("deny_listed");
            return SubmissionResult.denyListed();
        }

        String collection = RetrievalRequestedEvent.basename(collectionPath);
        LocalDateTime now = LocalDateTime.now();

        Optional<RetrievalJob> lastJob = jobRepository
                .findFirstByEmailIgnoreCaseAndCollectionAndStatusNotOrderByCreatedTimeDesc(
                        requesterEmail, collection, JobStatus.FAILED);

        if (lastJob.isPresent()) {
            LocalDateTime lastCreated = lastJob.get().getCreatedTime();
            Duration sinceLast = Duration.between(lastCreated, now);
            log.info("Last job request for {} by {} was on {}", collection, requesterEmail, lastCreated);

            if (sinceLast.compareTo(minimumJobInterval) < 0) {
                log.info("Time since last request is {}, less than minimum job interval of {} mins",
                        sinceLast, minimumJobInterval.toMinutes());
                metrics.recordSubmission("duplicate");
                return SubmissionResult.duplicate();
            }
        }

        RetrievalJob job = jobRepository.save(RetrievalJob.builder()
                .email(requesterEmail)
                .sourceIp(sourceIp)
                .collection(collection)
                .status(JobStatus.SUBMITTED)
                .createdTime(now)
                .build());

        log.info("Received job request for file: {}, from user: {}, with source ip: {}, assigned jobid: {}",
                collectionPath, requesterEmail, sourceIp, job.getJobId());

        publisher.publish(RetrievalRequestedEvent.builder()
                .sdaPath(collectionPath)
                .email(requesterEmail)
                .jobId(job.getJobId().toString())
                .build());

        metrics.recordSubmission("accepted");
        return SubmissionResult.accepted(job.getJobId());
    }
}
