package com.example.retrievalservice.controller;

import com.example.retrievalservice.dto.DownloadTokenSnapshot;
import com.example.retrievalservice.dto.request.IssueTokenRequest;
import com.example.retrievalservice.dto.response.JobResponse;
import com.example.retrievalservice.service.DownloadTokenService;
import com.example.retrievalservice.service.JobStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for retrieval jobs and the tokens issued against them.
 *
 * - GET /jobs/{jobId}: job status
 * - POST /jobs/{jobId}/tokens: issue a download token (job must be completed and owned by the email)
 * - GET /jobs/{jobId}/tokens: tokens for the job, newest first
 */
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobStatusService jobStatusService;
    private final DownloadTokenService downloadTokenService;

    @GetMapping("/{jobId}")
    public ResponseEntity<JobResponse> getJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(JobResponse.from(jobStatusService.getJob(jobId)));
    }

    @PostMapping("/{jobId}/tokens")
    public ResponseEntity<DownloadTokenSnapshot> issueToken(
            @PathVariable UUID jobId,
            @Valid @RequestBody IssueTokenRequest request) {

        DownloadTokenSnapshot token = downloadTokenService.issue(jobId, request.getEmail(),
                request.getMaxDownloads(), request.getExpiryHours());
        return ResponseEntity.status(HttpStatus.CREATED).body(token);
    }

    @GetMapping("/{jobId}/tokens")
    public ResponseEntity<List<DownloadTokenSnapshot>> listTokens(@PathVariable UUID jobId) {
        return ResponseEntity.ok(downloadTokenService.listForJob(jobId));
    }
}
