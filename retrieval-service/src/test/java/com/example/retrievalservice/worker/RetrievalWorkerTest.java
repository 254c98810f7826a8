package com.example.retrievalservice.worker;

import com.example.common.events.RetrievalRequestedEvent;
import com.example.retrievalservice.archive.ArchiveClient;
import com.example.retrievalservice.dto.DownloadTokenSnapshot;
import com.example.retrievalservice.exception.ArchiveRetrievalException;
import com.example.retrievalservice.metrics.RetrievalMetrics;
import com.example.retrievalservice.notification.NotificationService;
import com.example.retrievalservice.service.DownloadTokenService;
import com.example.retrievalservice.service.JobStatusService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.mail.MailSendException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalWorkerTest {

    private static final String REMOTE = "/hpss/isdp/a.zip";

    @TempDir
    Path stagingDir;

    @Mock
    private StagingCache stagingCache;

    @Mock
    private StagingAreaMonitor stagingAreaMonitor;

    @Mock
    private ArchiveClient archiveClient;

    @Mock
    private JobStatusService jobStatusService;

    @Mock
    private DownloadTokenService downloadTokenService;

    @Mock
    private NotificationService notificationService;

    @Mock
    private Acknowledgment ack;

    private final UUID jobId = UUID.randomUUID();
    private RetrievalRequestedEvent event;
    private Path localFile;

    @BeforeEach
    void setUp() {
        event = RetrievalRequestedEvent.builder()
                .sdaPath(REMOTE)
                .email("u@x.com")
                .jobId(jobId.toString())
                .build();
        localFile = stagingDir.resolve("a.zip");
    }

    private RetrievalWorker worker(boolean issueToken) {
        return new RetrievalWorker(stagingCache, stagingAreaMonitor, archiveClient, jobStatusService,
                downloadTokenService, notificationService, new RetrievalMetrics(new SimpleMeterRegistry()),
                "http://h/sds/", issueToken);
    }

    private void stagedFileOfSize(int bytes) throws IOException {
        Files.write(localFile, new byte[bytes]);
    }

    @Test
    void cacheHitCompletesWithoutArchivePull() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        stagedFileOfSize(3 * 1024 * 1024 + 10);

        JobOutcome outcome = worker(false).process(event, ack);

        assertThat(outcome).isEqualTo(JobOutcome.COMPLETED);
        verifyNoInteractions(archiveClient, stagingAreaMonitor);
        InOrder order = inOrder(jobStatusService, notificationService, ack);
        order.verify(jobStatusService).markProcessing(jobId);
        order.verify(jobStatusService).markCompleted(jobId, 3, "http://h/sds/a.zip");
        order.verify(notificationService).sendCompleted("u@x.com", "http://h/sds/a.zip");
        order.verify(ack).acknowledge();
    }

    @Test
    void cacheMissPullsFromArchive() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(false);
        when(stagingAreaMonitor.hasEnoughSpace()).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        doAnswer(invocation -> {
            Files.write(invocation.<Path>getArgument(1), new byte[1024]);
            return null;
        }).when(archiveClient).retrieve(REMOTE, localFile);

        JobOutcome outcome = worker(false).process(event, ack);

        assertThat(outcome).isEqualTo(JobOutcome.COMPLETED);
        verify(archiveClient).retrieve(REMOTE, localFile);
        verify(jobStatusService).markCompleted(jobId, 0, "http://h/sds/a.zip");
        verify(ack).acknowledge();
    }

    @Test
    void fullStagingAreaCancelsWithoutPull() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(false);
        when(stagingAreaMonitor.hasEnoughSpace()).thenReturn(false);

        JobOutcome outcome = worker(true).process(event, ack);

        assertThat(outcome).isEqualTo(JobOutcome.CANCELLED);
        verifyNoInteractions(archiveClient);
        verify(jobStatusService).markCancelled(jobId);
        verify(jobStatusService, never()).markProcessing(any());
        verify(notificationService).sendCancelled("u@x.com", "a.zip");
        verify(ack, times(1)).acknowledge();
    }

    @Test
    void archiveTimeoutFailsJobAndStillAcknowledges() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(false);
        when(stagingAreaMonitor.hasEnoughSpace()).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        doThrow(ArchiveRetrievalException.timeout(3300)).when(archiveClient).retrieve(anyString(), any());

        JobOutcome outcome = worker(true).process(event, ack);

        assertThat(outcome).isEqualTo(JobOutcome.FAILED);
        verify(jobStatusService).markProcessing(jobId);
        verify(jobStatusService).markFailed(jobId);
        verify(jobStatusService, never()).markCompleted(any(), anyLong(), anyString());
        verify(notificationService).sendFailed("u@x.com", "a.zip");
        verifyNoInteractions(downloadTokenService);
        verify(ack).acknowledge();
    }

    @Test
    void completionMailFailureDoesNotFailJob() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        stagedFileOfSize(10);
        doThrow(new MailSendException("smtp down")).when(notificationService).sendCompleted(anyString(), anyString());

        JobOutcome outcome = worker(false).process(event, ack);

        assertThat(outcome).isEqualTo(JobOutcome.COMPLETED);
        verify(jobStatusService, never()).markFailed(any());
        verify(ack).acknowledge();
    }

    @Test
    void failureNoticeErrorsAreSwallowed() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(false);
        when(stagingAreaMonitor.hasEnoughSpace()).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        doThrow(ArchiveRetrievalException.exitCode(72, "hsi")).when(archiveClient).retrieve(anyString(), any());
        doThrow(new MailSendException("smtp down")).when(notificationService).sendFailed(anyString(), anyString());

        assertThat(worker(false).process(event, ack)).isEqualTo(JobOutcome.FAILED);
        verify(ack).acknowledge();
    }

    @Test
    void issuedTokenIsAppendedToEmailedLink() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        stagedFileOfSize(10);
        when(downloadTokenService.issue(jobId, "u@x.com"))
                .thenReturn(DownloadTokenSnapshot.builder().token("0123abcd").build());

        worker(true).process(event, ack);

        verify(jobStatusService).markCompleted(jobId, 0, "http://h/sds/a.zip");
        verify(notificationService).sendCompleted("u@x.com", "http://h/sds/a.zip?token=0123abcd");
    }

    @Test
    void cacheLookupErrorIsTreatedAsMiss() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenThrow(new IOException("stat failed"));
        when(stagingAreaMonitor.hasEnoughSpace()).thenReturn(false);

        assertThat(worker(false).process(event, ack)).isEqualTo(JobOutcome.CANCELLED);
        verify(stagingAreaMonitor).hasEnoughSpace();
    }

    @Test
    void malformedJobIdIsDiscarded() {
        event.setJobId("not-a-uuid");

        assertThat(worker(false).process(event, ack)).isEqualTo(JobOutcome.DISCARDED);
        verifyNoInteractions(stagingCache, jobStatusService, notificationService);
        verify(ack).acknowledge();
    }

    @Test
    void acknowledgementErrorDoesNotChangeOutcome() throws Exception {
        when(stagingCache.isInCache("a.zip")).thenReturn(true);
        when(stagingCache.resolve("a.zip")).thenReturn(localFile);
        stagedFileOfSize(10);
        doThrow(new IllegalStateException("consumer closed")).when(ack).acknowledge();

        assertThat(worker(false).process(event, ack)).isEqualTo(JobOutcome.COMPLETED);
    }
}
