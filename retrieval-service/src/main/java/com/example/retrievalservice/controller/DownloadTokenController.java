package com.example.retrievalservice.controller;

import com.example.retrievalservice.dto.DownloadTokenSnapshot;
import com.example.retrievalservice.dto.TokenValidation;
import com.example.retrievalservice.service.DownloadTokenService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for download tokens.
 *
 * - GET /downloads/{token}: validate without consuming a download
 * - POST /downloads/{token}/record: count one download (403 once the token is no longer valid)
 * - POST /downloads/{token}/disable: revoke the token
 */
@RestController
@RequestMapping("/downloads")
@RequiredArgsConstructor
public class DownloadTokenController {

    private final DownloadTokenService downloadTokenService;

    @GetMapping("/{token}")
    public ResponseEntity<TokenValidation> validate(@PathVariable String token) {
        return ResponseEntity.ok(downloadTokenService.validate(token));
    }

    @PostMapping("/{token}/record")
    public ResponseEntity<DownloadTokenSnapshot> recordDownload(
            @PathVariable String token,
            HttpServletRequest request) {

        return ResponseEntity.ok(downloadTokenService.recordDownload(token, SubmissionController.clientIp(request)));
    }

    @PostMapping("/{token}/disable")
    public ResponseEntity<DownloadTokenSnapshot> disable(@PathVariable String token) {
        return ResponseEntity.ok(downloadTokenService.disable(token));
    }
}
