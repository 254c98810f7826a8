package com.example.retrievalservice.service;

import com.example.retrievalservice.entity.RetrievalJob;
import com.example.retrievalservice.exception.ResourceNotFoundException;
import com.example.retrievalservice.repository.RetrievalJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Job status writes used by the retrieval worker.
 * Each method is its own short transaction; nothing is held open across a retrieval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobStatusService {

    private final RetrievalJobRepository jobRepository;

    @Transactional
    public void markProcessing(UUID jobId) {
        RetrievalJob job = load(jobId);
        job.markProcessing();
        jobRepository.save(job);
        log.debug("Job {} marked processing", jobId);
    }

    @Transactional
    public void markCompleted(UUID jobId, long jobSizeMb, String downloadUrl) {
        RetrievalJob job = load(jobId);
        job.markCompleted(jobSizeMb, downloadUrl);
        jobRepository.save(job);
        log.debug("Job {} marked completed: size={}MB, url={}", jobId, jobSizeMb, downloadUrl);
    }

    @Transactional
    public void markFailed(UUID jobId) {
        RetrievalJob job = load(jobId);
        job.markFailed();
        jobRepository.save(job);
        log.debug("Job {} marked failed", jobId);
    }

    @Transactional
    public void markCancelled(UUID jobId) {
        RetrievalJob job = load(jobId);
        job.markCancelled();
        jobRepository.save(job);
        log.debug("Job {} marked cancelled", jobId);
    }

    @Transactional(readOnly = true)
    public RetrievalJob getJob(UUID jobId) {
        return load(jobId);
    }

    private RetrievalJob load(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> ResourceNotFoundException.jobNotFound(jobId));
    }
}
