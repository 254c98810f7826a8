package com.example.retrievalservice.dto;

import com.example.retrievalservice.entity.DownloadToken;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Point-in-time view of a download token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadTokenSnapshot {

    private Long tokenId;
    private String token;
    private UUID jobId;
    private String status;
    private int downloadCount;
    private int maxDownloads;
    private int remainingDownloads;
    private boolean valid;
    private LocalDateTime createdTime;
    private LocalDateTime expiresAt;
    private LocalDateTime lastDownloadTime;
    private String lastDownloadIp;

    public static DownloadTokenSnapshot from(DownloadToken token) {
        return DownloadTokenSnapshot.builder()
                .tokenId(token.getTokenId())
                .token(token.getToken())
                .jobId(token.getJobId())
                .status(token.getStatus().dbValue())
                .downloadCount(token.getDownloadCount())
                .maxDownloads(token.getMaxDownloads())
                .remainingDownloads(token.getRemainingDownloads())
                .valid(token.isValid())
                .createdTime(token.getCreatedTime())
                .expiresAt(token.getExpiresAt())
                .lastDownloadTime(token.getLastDownloadTime())
                .lastDownloadIp(token.getLastDownloadIp())
                .build();
    }
}
