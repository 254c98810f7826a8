package com.example.retrievalservice.repository;

import com.example.retrievalservice.entity.DownloadToken;
import com.example.retrievalservice.entity.JobStatus;
import com.example.retrievalservice.entity.RetrievalJob;
import com.example.retrievalservice.entity.TokenStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class DownloadTokenRepositoryTest {

    @Autowired
    private DownloadTokenRepository tokenRepository;

    @Autowired
    private RetrievalJobRepository jobRepository;

    private UUID jobId;

    @BeforeEach
    void setUp() {
        jobId = jobRepository.saveAndFlush(RetrievalJob.builder()
                .email("u@x.com")
                .collection("a.zip")
                .status(JobStatus.COMPLETED)
                .createdTime(LocalDateTime.now())
                .build()).getJobId();
    }

    private DownloadToken save(String value, TokenStatus status, int count, LocalDateTime created,
                               LocalDateTime expiresAt) {
        return tokenRepository.saveAndFlush(DownloadToken.builder()
                .token(value)
                .jobId(jobId)
                .status(status)
                .downloadCount(count)
                .maxDownloads(3)
                .createdTime(created)
                .expiresAt(expiresAt)
                .build());
    }

    @Test
    void sweepExpiresOnlyActiveTokensPastABoundAndIsIdempotent() {
        LocalDateTime now = LocalDateTime.now();
        save("live", TokenStatus.ACTIVE, 1, now, now.plusHours(1));
        save("old", TokenStatus.ACTIVE, 0, now.minusHours(25), now.minusHours(1));
        save("used", TokenStatus.ACTIVE, 3, now, now.plusHours(1));
        save("off", TokenStatus.DISABLED, 0, now.minusHours(25), now.minusHours(1));

        int first = tokenRepository.expireActiveTokens(now, TokenStatus.ACTIVE, TokenStatus.EXPIRED);
        int second = tokenRepository.expireActiveTokens(now, TokenStatus.ACTIVE, TokenStatus.EXPIRED);

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThat(tokenRepository.findByToken("live")).get()
                .extracting(DownloadToken::getStatus).isEqualTo(TokenStatus.ACTIVE);
        assertThat(tokenRepository.findByToken("old")).get()
                .extracting(DownloadToken::getStatus).isEqualTo(TokenStatus.EXPIRED);
        assertThat(tokenRepository.findByToken("used")).get()
                .extracting(DownloadToken::getStatus).isEqualTo(TokenStatus.EXPIRED);
        assertThat(tokenRepository.findByToken("off")).get()
                .extracting(DownloadToken::getStatus).isEqualTo(TokenStatus.DISABLED);
    }

    @Test
    void listsTokensForJobNewestFirst() {
        LocalDateTime now = LocalDateTime.now();
        save("first", TokenStatus.EXPIRED, 3, now.minusHours(2), now.plusHours(20));
        save("second", TokenStatus.ACTIVE, 0, now, now.plusHours(24));

        List<DownloadToken> tokens = tokenRepository.findByJobIdOrderByCreatedTimeDesc(jobId);

        assertThat(tokens).extracting(DownloadToken::getToken).containsExactly("second", "first");
        assertThat(tokenRepository.findByTokenForUpdate("first")).isPresent();
    }
}
