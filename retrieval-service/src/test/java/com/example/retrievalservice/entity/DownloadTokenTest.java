package com.example.retrievalservice.entity;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DownloadTokenTest {

    private DownloadToken activeToken(int maxDownloads, LocalDateTime expiresAt) {
        return DownloadToken.builder()
                .token("t")
                .jobId(UUID.randomUUID())
                .status(TokenStatus.ACTIVE)
                .maxDownloads(maxDownloads)
                .createdTime(LocalDateTime.now())
                .expiresAt(expiresAt)
                .build();
    }

    @Test
    void lastAllowedDownloadExpiresToken() {
        DownloadToken token = activeToken(2, LocalDateTime.now().plusHours(1));

        token.recordDownload("10.0.0.1");
        assertThat(token.isValid()).isTrue();
        assertThat(token.getRemainingDownloads()).isEqualTo(1);

        token.recordDownload("10.0.0.2");
        assertThat(token.getStatus()).isEqualTo(TokenStatus.EXPIRED);
        assertThat(token.isValid()).isFalse();
        assertThat(token.getRemainingDownloads()).isZero();
        assertThat(token.getLastDownloadIp()).isEqualTo("10.0.0.2");
    }

    @Test
    void tokenPastExpiryIsInvalidEvenWhileActive() {
        DownloadToken token = activeToken(3, LocalDateTime.now().minusSeconds(1));

        assertThat(token.getStatus()).isEqualTo(TokenStatus.ACTIVE);
        assertThat(token.isValid()).isFalse();
        assertThat(token.shouldExpire()).isTrue();
    }

    @Test
    void disabledTokenIsInvalid() {
        DownloadToken token = activeToken(3, LocalDateTime.now().plusHours(1));

        token.disable();

        assertThat(token.isValid()).isFalse();
        assertThat(token.shouldExpire()).isFalse();
    }
}
