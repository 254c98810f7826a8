package com.example.retrievalservice.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - retrieval_submissions_total: submissions by outcome (accepted, deny_listed, duplicate)
 * - retrieval_jobs_total: finished jobs by terminal status
 * - retrieval_cache_lookups_total: staging cache hits and misses
 * - retrieval_archive_duration_seconds: time spent in the archive tool
 * - retrieval_token_downloads_total: downloads counted against tokens
 */
@Component
public class RetrievalMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter tokenDownloadCounter;
    private final Timer archiveTimer;

    public RetrievalMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cacheHitCounter = Counter.builder("retrieval_cache_lookups_total")
                .description("Staging cache lookups")
                .tag("result", "hit")
                .register(meterRegistry);

        this.cacheMissCounter = Counter.builder("retrieval_cache_lookups_total")
                .tag("result", "miss")
                .register(meterRegistry);

        this.tokenDownloadCounter = Counter.builder("retrieval_token_downloads_total")
                .description("Downloads counted against download tokens")
                .register(meterRegistry);

        this.archiveTimer = Timer.builder("retrieval_archive_duration_seconds")
                .description("Duration of archive tool invocations")
                .register(meterRegistry);
    }

    public void recordSubmission(String outcome) {
        Counter.builder("retrieval_submissions_total")
                .description("Retrieval submissions by outcome")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordJobFinished(String status) {
        Counter.builder("retrieval_jobs_total")
                .description("Retrieval jobs by terminal status")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        if (hit) {
            cacheHitCounter.increment();
        } else {
            cacheMissCounter.increment();
        }
    }

    public void recordArchiveDuration(long durationMs) {
        archiveTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordTokenDownload() {
        tokenDownloadCounter.increment();
    }
}
