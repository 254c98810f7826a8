package com.example.retrievalservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Download token gating access to a completed job's artifact.
 *
 * A token expires when its expiry time passes or its download count reaches
 * max downloads. Tokens are never deleted, only moved out of ACTIVE.
 */
@Entity
@Table(name = "download_tokens", indexes = {
        @Index(name = "idx_download_tokens_job_id", columnList = "job_id"),
        @Index(name = "idx_download_tokens_status_expires", columnList = "status,expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "token_id")
    private Long tokenId;

    @Column(name = "token", nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "status", nullable = false, length = 20)
    private TokenStatus status;

    @Column(name = "download_count", nullable = false)
    private int downloadCount;

    @Column(name = "max_downloads", nullable = false)
    private int maxDownloads;

    @Column(name = "created_time", nullable = false, updatable = false)
    private LocalDateTime createdTime;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "last_download_time")
    private LocalDateTime lastDownloadTime;

    @Column(name = "last_download_ip")
    private String lastDownloadIp;

    /**
     * Check if token can be used for a download right now.
     */
    public boolean isValid() {
        return status == TokenStatus.ACTIVE
                && LocalDateTime.now().isBefore(expiresAt)
                && downloadCount < maxDownloads;
    }

    /**
     * Check if a time or count bound has been crossed.
     */
    public boolean shouldExpire() {
        return !LocalDateTime.now().isBefore(expiresAt) || downloadCount >= maxDownloads;
    }

    public int getRemainingDownloads() {
        return Math.max(0, maxDownloads - downloadCount);
    }

    /**
     * Count one download; flips to EXPIRED when the limit is reached.
     */
    public void recordDownload(String clientIp) {
        this.downloadCount++;
        this.lastDownloadTime = LocalDateTime.now();
        this.lastDownloadIp = clientIp;
        if (downloadCount >= maxDownloads) {
            this.status = TokenStatus.EXPIRED;
        }
    }

    public void expire() {
        this.status = TokenStatus.EXPIRED;
    }

    public void disable() {
        this.status = TokenStatus.DISABLED;
    }
}
