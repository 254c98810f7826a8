package com.example.retrievalservice.worker;

import com.example.retrievalservice.util.CsvColumns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Removes staged files nobody has read for longer than the TTL.
 *
 * Age is measured from the last access time, which the staging cache refreshes on every hit.
 * Files whose basename appears in the whitelist CSV (header {@code file}) are never purged.
 * Whitelist cells may not contain commas, so a basename with a comma cannot be whitelisted.
 */
@Component
@Slf4j
public class StagingHousekeeper {

    private final Path stagingDir;
    private final Duration ttl;
    private final String whitelistPath;

    public StagingHousekeeper(
            @Value("${retrieval.worker.staging-dir}") Path stagingDir,
            @Value("${retrieval.housekeeping.ttl-minutes:1440}") long ttlMinutes,
            @Value("${retrieval.housekeeping.whitelist-path:}") String whitelistPath) {
        this.stagingDir = stagingDir;
        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.whitelistPath = whitelistPath;
    }

    /**
     * @return number of files removed
     */
    public int purgeExpired() throws IOException {
        return purgeExpired(Instant.now());
    }

    int purgeExpired(Instant now) throws IOException {
        Set<String> whitelist = loadWhitelist();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(stagingDir)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }

        int purged = 0;
        for (Path file : files) {
            if (whitelist.contains(file.getFileName().toString())) {
                log.debug("{} is whitelisted, skip", file);
                continue;
            }
            try {
                Instant lastAccess = Files.readAttributes(file, BasicFileAttributes.class)
                        .lastAccessTime().toInstant();
                Duration idle = Duration.between(lastAccess, now);
                if (idle.compareTo(ttl) >= 0) {
                    log.info("Purging {} (last accessed {} min ago)", file, idle.toMinutes());
                    Files.deleteIfExists(file);
                    purged++;
                }
            } catch (NoSuchFileException e) {
                log.debug("{} disappeared during housekeeping", file);
            }
        }
        return purged;
    }

    private Set<String> loadWhitelist() {
        if (whitelistPath == null || whitelistPath.isBlank()) {
            return Collections.emptySet();
        }
        try {
            return CsvColumns.read(Files.readAllLines(Path.of(whitelistPath), StandardCharsets.UTF_8), "file");
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read housekeeping whitelist " + whitelistPath, e);
        }
    }
}
