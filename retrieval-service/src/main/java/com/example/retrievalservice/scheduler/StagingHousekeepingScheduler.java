package com.example.retrievalservice.scheduler;

import com.example.retrievalservice.worker.StagingHousekeeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Runs staging housekeeping on a cron. Off unless retrieval.housekeeping.enabled=true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "retrieval.housekeeping.enabled", havingValue = "true")
public class StagingHousekeepingScheduler {

    private final StagingHousekeeper housekeeper;

    @Scheduled(cron = "${retrieval.housekeeping.cron:0 30 2 * * *}")
    @SchedulerLock(
            name = "purgeStagingArea",
            lockAtMostFor = "30m",
            lockAtLeastFor = "1m"
    )
    public void purgeStagingArea() {
        String correlationId = "SCHEDULER-HOUSEKEEPING-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting staging housekeeping ===");
            int purged = housekeeper.purgeExpired();
            log.info("=== Completed staging housekeeping: {} file(s) purged ===", purged);
        } catch (Exception e) {
            log.error("Error in staging housekeeping: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
