package com.example.retrievalservice.repository;

import com.example.retrievalservice.entity.JobStatus;
import com.example.retrievalservice.entity.RetrievalJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for RetrievalJob entity.
 */
@Repository
public interface RetrievalJobRepository extends JpaRepository<RetrievalJob, UUID> {

    /**
     * Most recent job for the same requester and collection, ignoring jobs in the given status.
     * Used for duplicate detection with {@code JobStatus.FAILED} so failed attempts never block a retry.
     * Emails compare case-insensitively, as in the deny list and the token ownership check.
     */
    Optional<RetrievalJob> findFirstByEmailIgnoreCaseAndCollectionAndStatusNotOrderByCreatedTimeDesc(
            String email, String collection, JobStatus excludedStatus);
}
