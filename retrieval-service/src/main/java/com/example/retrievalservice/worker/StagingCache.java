package com.example.retrievalservice.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

/**
 * Lookup of already-staged files in the staging directory.
 *
 * A file that is present may still be growing because another worker is pulling it.
 * The lookup polls its size until two consecutive readings match. A file stuck at zero
 * bytes for longer than the zero-size limit is treated as an abandoned pull and removed.
 * Polling blocks the calling thread.
 */
@Component
@Slf4j
public class StagingCache {

    private final Path stagingDir;
    private final Duration pollInterval;
    private final Duration zeroSizeWaitLimit;

    public StagingCache(
            @Value("${retrieval.worker.staging-dir}") Path stagingDir,
            @Value("${retrieval.worker.cache-poll-interval:60s}") Duration pollInterval,
            @Value("${retrieval.worker.zero-size-wait-limit:600s}") Duration zeroSizeWaitLimit) {
        this.stagingDir = stagingDir;
        this.pollInterval = pollInterval;
        this.zeroSizeWaitLimit = zeroSizeWaitLimit;
    }

    public Path resolve(String filename) {
        return stagingDir.resolve(filename);
    }

    /**
     * @return true when a stable copy of {@code filename} is staged; its access time is
     *         refreshed and its modification time kept
     * @throws IOException if the file cannot be inspected
     */
    public boolean isInCache(String filename) throws IOException {
        Path localFile = resolve(filename);

        if (!Files.isRegularFile(localFile)) {
            return false;
        }

        long fileSize = Files.size(localFile);
        long zeroSizeWaitMs = 0;

        while (true) {
            sleep(pollInterval);

            // removed by another worker's cleanup
            if (!Files.isRegularFile(localFile)) {
                return false;
            }

            long currentSize;
            try {
                currentSize = Files.size(localFile);
            } catch (NoSuchFileException e) {
                return false;
            }

            if (currentSize == 0) {
                zeroSizeWaitMs += pollInterval.toMillis();
                if (zeroSizeWaitMs < zeroSizeWaitLimit.toMillis()) {
                    continue;
                }
                log.warn("{} stayed empty for {}ms, removing it as a dead download", localFile, zeroSizeWaitMs);
                Files.deleteIfExists(localFile);
                return false;
            }

            if (currentSize != fileSize) {
                fileSize = currentSize;
            } else {
                break;
            }
        }

        log.debug("Cache hit for {}", filename);
        touchAccessTime(localFile);
        return true;
    }

    private void touchAccessTime(Path localFile) throws IOException {
        // null leaves the modification and creation times untouched
        Files.getFileAttributeView(localFile, BasicFileAttributeView.class)
                .setTimes(null, FileTime.from(Instant.now()), null);
    }

    private static void sleep(Duration duration) throws IOException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for staged file to stabilise", e);
        }
    }
}
