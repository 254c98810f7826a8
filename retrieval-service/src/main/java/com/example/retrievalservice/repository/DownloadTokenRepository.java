package com.example.retrievalservice.repository;

import com.example.retrievalservice.entity.DownloadToken;
import com.example.retrievalservice.entity.TokenStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for DownloadToken entity.
 */
@Repository
public interface DownloadTokenRepository extends JpaRepository<DownloadToken, Long> {

    Optional<DownloadToken> findByToken(String token);

    /**
     * Find token with a row lock so concurrent downloads are counted one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM DownloadToken t WHERE t.token = :token")
    Optional<DownloadToken> findByTokenForUpdate(@Param("token") String token);

    List<DownloadToken> findByJobIdOrderByCreatedTimeDesc(UUID jobId);

    /**
     * Flip every active token past its expiry time or download limit.
     *
     * @return number of tokens flipped
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DownloadToken t SET t.status = :expired " +
           "WHERE t.status = :active " +
           "AND (t.expiresAt <= :now OR t.downloadCount >= t.maxDownloads)")
    int expireActiveTokens(@Param("now") LocalDateTime now,
                           @Param("active") TokenStatus active,
                           @Param("expired") TokenStatus expired);
}
