package com.example.retrievalservice.service;

import com.example.retrievalservice.util.CsvColumns;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Requester emails that may not submit retrieval requests.
 *
 * Loaded once at startup from a CSV file whose first row is a header containing an
 * {@code email} column. Cells may not contain commas, which addresses never do. An unset
 * path yields an empty list; a configured path that cannot be read or parsed fails startup.
 */
@Component
@Slf4j
public class DenyList {

    private final String denyListPath;
    private volatile Set<String> emails = Collections.emptySet();

    public DenyList(@Value("${retrieval.queue.deny-list-path:}") String denyListPath) {
        this.denyListPath = denyListPath;
    }

    @PostConstruct
    public void load() {
        if (denyListPath == null || denyListPath.isBlank()) {
            log.info("No deny list configured");
            return;
        }
        log.info("Loading deny list from file: {}", denyListPath);
        try {
            emails = parse(Files.readAllLines(Path.of(denyListPath), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read deny list " + denyListPath, e);
        }
        log.info("Loaded {} deny-listed email(s)", emails.size());
    }

    public boolean contains(String email) {
        return email != null && emails.contains(normalize(email));
    }

    public int size() {
        return emails.size();
    }

    static Set<String> parse(List<String> lines) {
        return CsvColumns.read(lines, "email").stream()
                .map(DenyList::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
