package com.example.retrievalservice.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Staging area usage check used for admission control on cache misses.
 *
 * This is a point-in-time scan. It is only meaningful while a single worker writes to
 * the staging directory.
 */
@Component
@Slf4j
public class StagingAreaMonitor {

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final Path stagingDir;
    private final double usageThresholdGb;

    public StagingAreaMonitor(
            @Value("${retrieval.worker.staging-dir}") Path stagingDir,
            @Value("${retrieval.worker.staging-usage-threshold-gb:950}") double usageThresholdGb) {
        this.stagingDir = stagingDir;
        this.usageThresholdGb = usageThresholdGb;
    }

    /**
     * Total size in bytes of the files directly inside the staging directory.
     */
    public long usedBytes() throws IOException {
        long size = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(stagingDir)) {
            for (Path entry : entries) {
                BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
                if (attrs.isRegularFile()) {
                    size += attrs.size();
                }
            }
        }
        return size;
    }

    /**
     * @return false when usage has reached the threshold
     */
    public boolean hasEnoughSpace() throws IOException {
        double usedGb = usedBytes() / BYTES_PER_GB;
        log.debug("Checking storage usage, used: {} GB, threshold: {} GB", usedGb, usageThresholdGb);
        return usedGb < usageThresholdGb;
    }
}
