package com.example.retrievalservice.worker;

import com.example.common.events.RetrievalRequestedEvent;
import com.example.retrievalservice.archive.ArchiveClient;
import com.example.retrievalservice.dto.DownloadTokenSnapshot;
import com.example.retrievalservice.metrics.RetrievalMetrics;
import com.example.retrievalservice.notification.NotificationService;
import com.example.retrievalservice.service.DownloadTokenService;
import com.example.retrievalservice.service.JobStatusService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Processes one retrieval request end to end.
 *
 * Flow:
 * 1. Look the collection up in the staging cache (lookup errors count as a miss)
 * 2. On a miss with the staging area full: reject the message, mark the job cancelled, notify
 * 3. Otherwise mark processing, pull from the archive on a miss, then mark completed and notify
 * 4. Any failure after step 2: mark failed and notify
 *
 * The message is acknowledged exactly once on every path. A rejected message is
 * committed without redelivery.
 */
@Component
@Slf4j
public class RetrievalWorker {

    private final StagingCache stagingCache;
    private final StagingAreaMonitor stagingAreaMonitor;
    private final ArchiveClient archiveClient;
    private final JobStatusService jobStatusService;
    private final DownloadTokenService downloadTokenService;
    private final NotificationService notificationService;
    private final RetrievalMetrics metrics;
    private final String downloadBaseUrl;
    private final boolean issueTokenOnCompletion;

    public RetrievalWorker(
            StagingCache stagingCache,
            StagingAreaMonitor stagingAreaMonitor,
            ArchiveClient archiveClient,
            JobStatusService jobStatusService,
            DownloadTokenService downloadTokenService,
            NotificationService notificationService,
            RetrievalMetrics metrics,
            @Value("${retrieval.worker.download-base-url}") String downloadBaseUrl,
            @Value("${retrieval.worker.issue-token-on-completion:true}") boolean issueTokenOnCompletion) {
        this.stagingCache = stagingCache;
        this.stagingAreaMonitor = stagingAreaMonitor;
        this.archiveClient = archiveClient;
        this.jobStatusService = jobStatusService;
        this.downloadTokenService = downloadTokenService;
        this.notificationService = notificationService;
        this.metrics = metrics;
        this.downloadBaseUrl = trimTrailingSlash(downloadBaseUrl);
        this.issueTokenOnCompletion = issueTokenOnCompletion;
    }

    public JobOutcome process(RetrievalRequestedEvent event, Acknowledgment ack) {
        MDC.put("correlationId", String.valueOf(event.getJobId()));
        boolean rejected = false;
        try {
            UUID jobId = parseJobId(event.getJobId());
            if (jobId == null || event.getSdaPath() == null || event.getEmail() == null) {
                log.error("Discarding malformed retrieval request: {}", event);
                return JobOutcome.DISCARDED;
            }

            String basename = event.collectionName();
            log.info("Received job request for file: {}, from user: {}, jobid: {}",
                    event.getSdaPath(), event.getEmail(), jobId);

            boolean inCache = lookupCache(basename);
            metrics.recordCacheLookup(inCache);

            boolean enoughSpace;
            try {
                enoughSpace = inCache || stagingAreaMonitor.hasEnoughSpace();
            } catch (IOException e) {
                log.error("Could not measure staging area usage: {}", e.getMessage(), e);
                fail(jobId, event.getEmail(), basename);
                return JobOutcome.FAILED;
            }

            if (!enoughSpace) {
                rejected = true;
                reject(ack, jobId);
                cancel(jobId, event.getEmail(), basename);
                return JobOutcome.CANCELLED;
            }

            return retrieve(jobId, event, basename, inCache);
        } finally {
            if (!rejected) {
                acknowledge(ack);
            }
            MDC.remove("correlationId");
        }
    }

    private JobOutcome retrieve(UUID jobId, RetrievalRequestedEvent event, String basename, boolean inCache) {
        try {
            jobStatusService.markProcessing(jobId);

            Path localFile = stagingCache.resolve(basename);
            if (inCache) {
                log.info("{} is already staged, skipping archive pull", basename);
            } else {
                long started = System.currentTimeMillis();
                archiveClient.retrieve(event.getSdaPath(), localFile);
                metrics.recordArchiveDuration(System.currentTimeMillis() - started);
            }

            long jobSizeMb = Files.size(localFile) >> 20;
            String downloadUrl = downloadBaseUrl + "/" + basename;
            jobStatusService.markCompleted(jobId, jobSizeMb, downloadUrl);
            metrics.recordJobFinished("completed");
            log.info("Job {} completed: {} MB at {}", jobId, jobSizeMb, downloadUrl);

            try {
                notificationService.sendCompleted(event.getEmail(), downloadLink(jobId, event.getEmail(), downloadUrl));
            } catch (Exception e) {
                log.warn("Could not send completion email for job {}: {}", jobId, e.getMessage());
            }
            return JobOutcome.COMPLETED;
        } catch (Exception e) {
            log.error("Retrieval failed for job {}: {}", jobId, e.getMessage(), e);
            fail(jobId, event.getEmail(), basename);
            return JobOutcome.FAILED;
        }
    }

    // the job is already completed here, so a token failure only degrades the link
    private String downloadLink(UUID jobId, String email, String downloadUrl) {
        if (!issueTokenOnCompletion) {
            return downloadUrl;
        }
        try {
            DownloadTokenSnapshot token = downloadTokenService.issue(jobId, email);
            return downloadUrl + "?token=" + token.getToken();
        } catch (Exception e) {
            log.warn("Could not issue download token for job {}: {}", jobId, e.getMessage());
            return downloadUrl;
        }
    }

    private boolean lookupCache(String basename) {
        try {
            return stagingCache.isInCache(basename);
        } catch (IOException e) {
            log.warn("Error in cache lookup: {}", e.getMessage());
            return false;
        }
    }

    private void cancel(UUID jobId, String email, String basename) {
        log.info("Staging area is full, cancelling job {}", jobId);
        try {
            jobStatusService.markCancelled(jobId);
            metrics.recordJobFinished("cancelled");
        } catch (Exception e) {
            log.error("Could not mark job {} cancelled: {}", jobId, e.getMessage());
        }
        try {
            notificationService.sendCancelled(email, basename);
            log.info("Sent cancellation email notification to user");
        } catch (Exception e) {
            log.warn("Could not send cancellation email for job {}: {}", jobId, e.getMessage());
        }
    }

    private void fail(UUID jobId, String email, String basename) {
        try {
            jobStatusService.markFailed(jobId);
            metrics.recordJobFinished("failed");
        } catch (Exception e) {
            log.error("Could not mark job {} failed: {}", jobId, e.getMessage());
        }
        try {
            notificationService.sendFailed(email, basename);
            log.info("Sent job failure email to user");
        } catch (Exception e) {
            log.warn("Could not send failure email for job {}: {}", jobId, e.getMessage());
        }
    }

    private void reject(Acknowledgment ack, UUID jobId) {
        log.info("Rejecting message for job {} without requeue", jobId);
        acknowledge(ack);
    }

    private void acknowledge(Acknowledgment ack) {
        try {
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Failed to acknowledge message: {}", e.getMessage(), e);
        }
    }

    private static UUID parseJobId(String jobId) {
        if (jobId == null) {
            return null;
        }
        try {
            return UUID.fromString(jobId);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
