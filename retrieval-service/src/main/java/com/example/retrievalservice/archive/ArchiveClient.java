package com.example.retrievalservice.archive;

import java.nio.file.Path;

/**
 * Pulls a file out of the tape archive into local storage.
 */
public interface ArchiveClient {

    /**
     * Copy {@code remotePath} from the archive to {@code localFile}, blocking until done.
     * On failure no partial file is left behind.
     *
     * @throws com.example.retrievalservice.exception.ArchiveRetrievalException on non-zero exit or timeout
     */
    void retrieve(String remotePath, Path localFile);
}
