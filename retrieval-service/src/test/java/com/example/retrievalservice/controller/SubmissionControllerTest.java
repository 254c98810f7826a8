package com.example.retrievalservice.controller;

import com.example.retrievalservice.dto.SubmissionResult;
import com.example.retrievalservice.exception.GlobalExceptionHandler;
import com.example.retrievalservice.exception.QueuePublishException;
import com.example.retrievalservice.service.SubmissionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SubmissionControllerTest {

    @Mock
    private SubmissionService submissionService;

    @InjectMocks
    private SubmissionController submissionController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(submissionController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void acceptedRequestIsAcknowledged() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(submissionService.submit("/hpss/a.zip", "u@x.com", "203.0.113.9"))
                .thenReturn(SubmissionResult.accepted(jobId));

        mockMvc.perform(get("/sds/pull")
                        .param("p", "/hpss/a.zip")
                        .param("uid", "u@x.com")
                        .header("X-Real-IP", "203.0.113.9")
                        .header("X-Forwarded-For", "198.51.100.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Acknowledgement").exists())
                .andExpect(jsonPath("$.jobId").value(jobId.toString()));
    }

    @Test
    void forwardedForUsedWithoutRealIp() throws Exception {
        when(submissionService.submit("/hpss/a.zip", "u@x.com", "198.51.100.1"))
                .thenReturn(SubmissionResult.duplicate());

        mockMvc.perform(post("/sds/pull")
                        .param("p", "/hpss/a.zip")
                        .param("uid", "u@x.com")
                        .header("X-Forwarded-For", "198.51.100.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['Invalid Request']").exists());
    }

    @Test
    void onlyClientHopOfForwardedChainIsRecorded() throws Exception {
        when(submissionService.submit("/hpss/a.zip", "u@x.com", "2001:db8:85a3::8a2e:370:7334"))
                .thenReturn(SubmissionResult.duplicate());

        mockMvc.perform(post("/sds/pull")
                        .param("p", "/hpss/a.zip")
                        .param("uid", "u@x.com")
                        .header("X-Forwarded-For",
                                "2001:db8:85a3::8a2e:370:7334, 2001:db8:85a3::8a2e:370:7335, 10.0.0.1"))
                .andExpect(status().isOk());

        verify(submissionService).submit("/hpss/a.zip", "u@x.com", "2001:db8:85a3::8a2e:370:7334");
    }

    @Test
    void blankForwardedHopFallsBackToRemoteAddress() throws Exception {
        when(submissionService.submit("/hpss/a.zip", "u@x.com", "127.0.0.1"))
                .thenReturn(SubmissionResult.duplicate());

        mockMvc.perform(post("/sds/pull")
                        .param("p", "/hpss/a.zip")
                        .param("uid", "u@x.com")
                        .header("X-Forwarded-For", " , 10.0.0.1"))
                .andExpect(status().isOk());
    }

    @Test
    void queueOutageIsServiceUnavailable() throws Exception {
        when(submissionService.submit(anyString(), anyString(), anyString()))
                .thenThrow(new QueuePublishException("job-1", new IllegalStateException("broker down")));

        mockMvc.perform(get("/sds/pull").param("p", "/hpss/a.zip").param("uid", "u@x.com"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("QUEUE_UNAVAILABLE"));
    }

    @Test
    void denyListedRequesterGetsWarning() throws Exception {
        when(submissionService.submit(anyString(), anyString(), anyString()))
                .thenReturn(SubmissionResult.denyListed());

        mockMvc.perform(get("/sds/pull").param("p", "/hpss/a.zip").param("uid", "bad@x.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.Warning").exists());
        verify(submissionService).submit("/hpss/a.zip", "bad@x.com", "127.0.0.1");
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/sds/pull").param("p", "/hpss/a.zip"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
        verifyNoInteractions(submissionService);
    }
}
