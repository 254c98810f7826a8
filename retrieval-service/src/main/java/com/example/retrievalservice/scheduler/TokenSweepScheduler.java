package com.example.retrievalservice.scheduler;

import com.example.retrievalservice.service.DownloadTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Periodically flips active download tokens past their expiry or download limit to expired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "retrieval.tokens.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class TokenSweepScheduler {

    private final DownloadTokenService downloadTokenService;

    @Scheduled(cron = "${retrieval.tokens.sweep-cron:0 0 * * * *}")
    @SchedulerLock(
            name = "sweepExpiredTokens",
            lockAtMostFor = "10m",
            lockAtLeastFor = "30s"
    )
    public void sweepExpiredTokens() {
        String correlationId = "SCHEDULER-TOKENS-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            int expired = downloadTokenService.sweepExpired();
            log.info("Token sweep finished: {} token(s) expired", expired);
        } catch (Exception e) {
            log.error("Error in scheduled token sweep: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
