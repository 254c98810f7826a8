package com.example.retrievalservice.archive;

import com.example.retrievalservice.exception.ArchiveRetrievalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Archive client backed by the HSI command line tool.
 *
 * The command is composed as one string and run through {@code /bin/sh -c}:
 * <pre>
 *   hsi -d2 -A keytab -k KEYTAB -l USER "firewall -on; get LOCAL : REMOTE"   (firewall mode)
 *   hsi -d2 -A keytab -k KEYTAB -l USER get LOCAL : REMOTE
 * </pre>
 * Paths are passed to the shell unescaped, so collection paths must not contain shell
 * metacharacters.
 */
@Component
@Slf4j
public class HsiArchiveClient implements ArchiveClient {

    private static final long KILL_WAIT_SECONDS = 10;

    private final String binPath;
    private final String keytabPath;
    private final String user;
    private final boolean firewallMode;
    private final long timeoutSeconds;

    public HsiArchiveClient(
            @Value("${archive.hsi.bin-path:hsi}") String binPath,
            @Value("${archive.hsi.keytab-path:}") String keytabPath,
            @Value("${archive.hsi.user:}") String user,
            @Value("${archive.hsi.firewall-mode:true}") boolean firewallMode,
            @Value("${archive.hsi.timeout-seconds:3300}") long timeoutSeconds) {
        this.binPath = binPath;
        this.keytabPath = keytabPath;
        this.user = user;
        this.firewallMode = firewallMode;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void retrieve(String remotePath, Path localFile) {
        String command = buildCommand(localFile, remotePath);
        log.debug("cmd to execute: {}", command);

        Process process;
        try {
            process = new ProcessBuilder("/bin/sh", "-c", command)
                    .inheritIO()
                    .start();
        } catch (IOException e) {
            deletePartialFile(localFile);
            throw new ArchiveRetrievalException("Cannot start archive tool: " + e.getMessage(), e);
        }

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                log.error("Archive pull timed out after {}s for {}", timeoutSeconds, remotePath);
                terminate(process);
                deletePartialFile(localFile);
                throw ArchiveRetrievalException.timeout(timeoutSeconds);
            }

            int exitCode = process.exitValue();
            log.debug("return code: {}", exitCode);
            if (exitCode != 0) {
                deletePartialFile(localFile);
                throw ArchiveRetrievalException.exitCode(exitCode, command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process);
            deletePartialFile(localFile);
            throw new ArchiveRetrievalException("Interrupted while waiting for archive tool", e);
        }

        log.debug("Done writing {}", localFile);
    }

    String buildCommand(Path localFile, String remotePath) {
        List<String> parts = new ArrayList<>(List.of(
                binPath, "-d2", "-A", "keytab", "-k", keytabPath, "-l", user));

        if (firewallMode) {
            parts.add(String.format("\"firewall -on; get %s : %s\"", localFile, remotePath));
        } else {
            parts.addAll(List.of("get", localFile.toString(), ":", remotePath));
        }
        return String.join(" ", parts);
    }

    private void terminate(Process process) {
        // the shell's children (the tool itself) go first, otherwise they outlive the shell
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Archive tool process {} did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void deletePartialFile(Path localFile) {
        try {
            if (Files.deleteIfExists(localFile)) {
                log.info("Removed partially retrieved file {}", localFile);
            }
        } catch (IOException e) {
            log.warn("Could not remove partial file {}: {}", localFile, e.getMessage());
        }
    }
}
