package com.example.common.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Retrieval Requested Event
 *
 * Published by: Submission gateway once a job row has been written
 * Consumed by: Retrieval worker (one message in flight per worker process)
 *
 * Wire format (JSON): {"sda_path": "...", "email": "...", "job_id": "..."}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetrievalRequestedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Full path of the collection inside the tape archive.
     */
    @JsonProperty("sda_path")
    private String sdaPath;

    /**
     * Requester email, used for notifications.
     */
    @JsonProperty("email")
    private String email;

    /**
     * Job ID assigned at submission.
     */
    @JsonProperty("job_id")
    private String jobId;

    /**
     * Basename of the archive path; this is the file name used in the staging area.
     */
    public String collectionName() {
        return basename(sdaPath);
    }

    public static String basename(String path) {
        if (path == null) {
            return null;
        }
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int idx = trimmed.lastIndexOf('/');
        return idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
    }
}
