package com.example.retrievalservice.controller;

import com.example.retrievalservice.dto.SubmissionResult;
import com.example.retrievalservice.dto.response.SubmissionResponse;
import com.example.retrievalservice.service.SubmissionService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Submission endpoint for archive retrieval requests.
 *
 * GET|POST /sds/pull?p={archive path}&uid={email}
 * Rejections (deny list, duplicate) are normal 200 responses carrying a user-facing message.
 */
@RestController
@RequestMapping("/sds")
@RequiredArgsConstructor
@Slf4j
public class SubmissionController {

    private final SubmissionService submissionService;

    @RequestMapping(value = "/pull", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Map<String, String>> pull(
            @RequestParam("p") String collectionPath,
            @RequestParam("uid") String requesterEmail,
            HttpServletRequest request) {

        SubmissionResult result = submissionService.submit(collectionPath, requesterEmail, clientIp(request));
        return ResponseEntity.ok(SubmissionResponse.from(result));
    }

    static String clientIp(HttpServletRequest request) {
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }
        // "client, proxy1, proxy2": only the first hop is the client
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String clientHop = forwardedFor.split(",", 2)[0].trim();
            if (!clientHop.isEmpty()) {
                return clientHop;
            }
        }
        return request.getRemoteAddr();
    }
}
