package com.example.retrievalservice.service;

import com.example.retrievalservice.dto.DownloadTokenSnapshot;
import com.example.retrievalservice.dto.TokenValidation;
import com.example.retrievalservice.entity.DownloadToken;
import com.example.retrievalservice.entity.JobStatus;
import com.example.retrievalservice.entity.RetrievalJob;
import com.example.retrievalservice.entity.TokenStatus;
import com.example.retrievalservice.exception.ForbiddenException;
import com.example.retrievalservice.exception.JobNotReadyException;
import com.example.retrievalservice.exception.ResourceNotFoundException;
import com.example.retrievalservice.exception.TokenNotFoundException;
import com.example.retrievalservice.metrics.RetrievalMetrics;
import com.example.retrievalservice.repository.DownloadTokenRepository;
import com.example.retrievalservice.repository.RetrievalJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Download token issuance, validation and usage accounting.
 *
 * Token policy: valid while ACTIVE, before expires_at and below max_downloads.
 * Format: 32 hex chars, a truncated SHA-256 over job id, requester, time and random bytes.
 */
@Service
public class DownloadTokenService {

    private static final Logger log = LoggerFactory.getLogger(DownloadTokenService.class);

    private static final int TOKEN_LENGTH = 32;
    private static final int RANDOM_BYTES = 16;

    private final DownloadTokenRepository tokenRepository;
    private final RetrievalJobRepository jobRepository;
    private final RetrievalMetrics metrics;
    private final int defaultMaxDownloads;
    private final int defaultExpiryHours;
    private final SecureRandom secureRandom = new SecureRandom();

    public DownloadTokenService(
            DownloadTokenRepository tokenRepository,
            RetrievalJobRepository jobRepository,
            RetrievalMetrics metrics,
            @Value("${retrieval.tokens.max-downloads:3}") int defaultMaxDownloads,
            @Value("${retrieval.tokens.expiry-hours:24}") int defaultExpiryHours) {
        this.tokenRepository = tokenRepository;
        this.jobRepository = jobRepository;
        this.metrics = metrics;
        this.defaultMaxDownloads = defaultMaxDownloads;
        this.defaultExpiryHours = defaultExpiryHours;
    }

    /**
     * Issue a token with the configured download limit and lifetime.
     */
    @Transactional
    public DownloadTokenSnapshot issue(UUID jobId, String requesterEmail) {
        return issue(jobId, requesterEmail, null, null);
    }

    /**
     * Issue a token for a completed job owned by the requester.
     * A null limit falls back to the configured default.
     *
     * @throws ResourceNotFoundException if the job does not exist
     * @throws ForbiddenException if the job belongs to someone else
     * @throws JobNotReadyException if the job has not completed
     */
    @Transactional
    public DownloadTokenSnapshot issue(UUID jobId, String requesterEmail, Integer maxDownloadsOrNull,
                                       Integer expiryHoursOrNull) {
        int maxDownloads = maxDownloadsOrNull != null ? maxDownloadsOrNull : defaultMaxDownloads;
        int expiryHours = expiryHoursOrNull != null ? expiryHoursOrNull : defaultExpiryHours;
        if (maxDownloads < 1) {
            throw new IllegalArgumentException("maxDownloads must be at least 1");
        }
        if (expiryHours < 1) {
            throw new IllegalArgumentException("expiryHours must be at least 1");
        }

        RetrievalJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> ResourceNotFoundException.jobNotFound(jobId));

        if (requesterEmail == null || !job.getEmail().equalsIgnoreCase(requesterEmail)) {
            throw ForbiddenException.notJobOwner(jobId);
        }
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotReadyException(jobId, job.getStatus());
        }

        LocalDateTime now = LocalDateTime.now();
        DownloadToken token = DownloadToken.builder()
                .token(generateToken(jobId, requesterEmail))
                .jobId(jobId)
                .status(TokenStatus.ACTIVE)
                .downloadCount(0)
                .maxDownloads(maxDownloads)
                .createdTime(now)
                .expiresAt(now.plusHours(expiryHours))
                .build();

        DownloadToken saved = tokenRepository.save(token);
        log.info("Issued download token {} for job {} (max downloads {}, expires {})",
                saved.getTokenId(), jobId, maxDownloads, saved.getExpiresAt());

        return DownloadTokenSnapshot.from(saved);
    }

    /**
     * Check whether a token can be used. A token found past its time or count bound
     * is flipped to EXPIRED before returning.
     *
     * @throws TokenNotFoundException if the token does not exist
     */
    @Transactional
    public TokenValidation validate(String tokenString) {
        DownloadToken token = tokenRepository.findByToken(tokenString)
                .orElseThrow(TokenNotFoundException::new);

        if (token.isValid()) {
            return TokenValidation.valid(DownloadTokenSnapshot.from(token));
        }

        String reason = invalidReason(token);
        expireIfBoundCrossed(token);
        return TokenValidation.invalid(reason, DownloadTokenSnapshot.from(token));
    }

    /**
     * Count a download against the token. The row is locked for the duration of the
     * update so concurrent downloads cannot exceed the limit.
     *
     * @throws TokenNotFoundException if the token does not exist
     * @throws ForbiddenException if the token is no longer valid
     */
    @Transactional(noRollbackFor = ForbiddenException.class)
    public DownloadTokenSnapshot recordDownload(String tokenString, String clientIp) {
        DownloadToken token = tokenRepository.findByTokenForUpdate(tokenString)
                .orElseThrow(TokenNotFoundException::new);

        if (!token.isValid()) {
            String reason = invalidReason(token);
            expireIfBoundCrossed(token);
            log.warn("Rejected download for token {}: {}", token.getTokenId(), reason);
            throw ForbiddenException.tokenInvalid(reason);
        }

        token.recordDownload(clientIp);
        DownloadToken saved = tokenRepository.save(token);
        metrics.recordTokenDownload();

        log.info("Recorded download {}/{} for token {} from {}",
                saved.getDownloadCount(), saved.getMaxDownloads(), saved.getTokenId(), clientIp);
        if (saved.getStatus() == TokenStatus.EXPIRED) {
            log.info("Token {} reached its download limit and is now expired", saved.getTokenId());
        }

        return DownloadTokenSnapshot.from(saved);
    }

    /**
     * Flip every active token past either bound to EXPIRED.
     *
     * @return number of tokens flipped by this call
     */
    @Transactional
    public int sweepExpired() {
        int expired = tokenRepository.expireActiveTokens(
                LocalDateTime.now(), TokenStatus.ACTIVE, TokenStatus.EXPIRED);
        if (expired > 0) {
            log.info("Expired {} download token(s)", expired);
        }
        return expired;
    }

    @Transactional
    public DownloadTokenSnapshot disable(String tokenString) {
        DownloadToken token = tokenRepository.findByToken(tokenString)
                .orElseThrow(TokenNotFoundException::new);
        token.disable();
        log.info("Disabled download token {}", token.getTokenId());
        return DownloadTokenSnapshot.from(tokenRepository.save(token));
    }

    @Transactional(readOnly = true)
    public List<DownloadTokenSnapshot> listForJob(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw ResourceNotFoundException.jobNotFound(jobId);
        }
        return tokenRepository.findByJobIdOrderByCreatedTimeDesc(jobId).stream()
                .map(DownloadTokenSnapshot::from)
                .toList();
    }

    String generateToken(UUID jobId, String requesterEmail) {
        byte[] random = new byte[RANDOM_BYTES];
        secureRandom.nextBytes(random);
        Instant now = Instant.now();
        String data = jobId + ":" + requesterEmail + ":" + now.getEpochSecond() + "." + now.getNano()
                + ":" + HexFormat.of().formatHex(random);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TOKEN_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void expireIfBoundCrossed(DownloadToken token) {
        if (token.getStatus() == TokenStatus.ACTIVE && token.shouldExpire()) {
            token.expire();
            tokenRepository.save(token);
            log.info("Token {} flipped to expired", token.getTokenId());
        }
    }

    private static String invalidReason(DownloadToken token) {
        if (token.getStatus() != TokenStatus.ACTIVE) {
            return "Token is " + token.getStatus().dbValue();
        }
        if (!LocalDateTime.now().isBefore(token.getExpiresAt())) {
            long hours = Duration.between(token.getCreatedTime(), token.getExpiresAt()).toHours();
            return String.format("Token has expired (%d hours elapsed)", hours);
        }
        if (token.getDownloadCount() >= token.getMaxDownloads()) {
            return String.format("Token has reached maximum downloads (%d)", token.getMaxDownloads());
        }
        return "Token is invalid";
    }
}
