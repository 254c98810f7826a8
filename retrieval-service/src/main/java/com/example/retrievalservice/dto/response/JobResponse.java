package com.example.retrievalservice.dto.response;

import com.example.retrievalservice.entity.RetrievalJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for a retrieval job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID jobId;
    private String email;
    private String collection;
    private String status;
    private Long jobSizeMb;
    private String downloadUrl;
    private LocalDateTime createdTime;

    public static JobResponse from(RetrievalJob job) {
        return JobResponse.builder()
                .jobId(job.getJobId())
                .email(job.getEmail())
                .collection(job.getCollection())
                .status(job.getStatus().dbValue())
                .jobSizeMb(job.getJobSizeMb())
                .downloadUrl(job.getDownloadUrl())
                .createdTime(job.getCreatedTime())
                .build();
    }
}
