package com.example.retrievalservice.entity;

import com.example.retrievalservice.exception.InvalidJobStateException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Retrieval job, one row per accepted request.
 *
 * Rows are never deleted; the table doubles as the audit trail of requests.
 * Status is written only by the retrieval worker once the row exists.
 */
@Entity
@Table(name = "userjobs", indexes = {
        @Index(name = "idx_userjobs_email_collection", columnList = "email,collection"),
        @Index(name = "idx_userjobs_date_created", columnList = "dateCreated")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrievalJob {

    @Id
    @UuidGenerator(style = UuidGenerator.Style.TIME)
    @Column(name = "jobid", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "sourceIP")
    private String sourceIp;

    @Column(name = "collection", nullable = false)
    private String collection;

    @Column(name = "jobStatus", nullable = false, length = 20)
    private JobStatus status;

    /**
     * Size of the staged file in whole megabytes.
     */
    @Column(name = "jobSize")
    private Long jobSizeMb;

    @Column(name = "downloadURL", columnDefinition = "TEXT")
    private String downloadUrl;

    @Column(name = "dateCreated", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @PrePersist
    protected void onCreate() {
        if (createdTime == null) {
            createdTime = LocalDateTime.now();
        }
        if (status == null) {
            status = JobStatus.SUBMITTED;
        }
    }

    public void markProcessing() {
        transitionTo(JobStatus.PROCESSING);
    }

    public void markCompleted(long jobSizeMb, String downloadUrl) {
        transitionTo(JobStatus.COMPLETED);
        this.jobSizeMb = jobSizeMb;
        this.downloadUrl = downloadUrl;
    }

    public void markFailed() {
        transitionTo(JobStatus.FAILED);
    }

    public void markCancelled() {
        transitionTo(JobStatus.CANCELLED);
    }

    private void transitionTo(JobStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw InvalidJobStateException.illegalTransition(jobId, status, target);
        }
        this.status = target;
    }
}
