package com.example.oncallrotation.controller;

import com.example.oncallrotation.dto.SlackCommandRequest;
import com.example.oncallrotation.dto.SlackCommandResponse;
import com.example.oncallrotation.exception.InvalidInputException;
import com.example.oncallrotation.exception.ResourceNotFoundException;
import com.example.oncallrotation.service.SlackInstallationService;
import com.example.oncallrotation.service.command.SlackCommandService;
import com.example.oncallrotation.service.command.SlackSignatureVerifier;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StreamUtils;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Endpoints called by Slack: slash commands and the OAuth redirect.
 * <p>
 * Command failures are answered with an ephemeral message, since Slack shows nothing useful for
 * non-2xx replies.
 */
@Slf4j
@Hidden
@RestController
@RequiredArgsConstructor
@RequestMapping("/slack")
public class SlackCommandController {

    private final SlackSignatureVerifier signatureVerifier;
    private final SlackCommandService commandService;
    private final SlackInstallationService installationService;

    @PostMapping(value = "/commands", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public SlackCommandResponse command(
            @RequestHeader(value = "X-Slack-Request-Timestamp", required = false) String timestamp,
            @RequestHeader(value = "X-Slack-Signature", required = false) String signature,
            HttpServletRequest servletRequest) throws IOException {

        // raw bytes, the signature covers the body exactly as sent
        var body = StreamUtils.copyToString(servletRequest.getInputStream(), StandardCharsets.UTF_8);
        signatureVerifier.verify(timestamp, signature, body);

        SlackCommandRequest request;
        try {
            request = SlackCommandRequest.fromForm(body);
        } catch (InvalidInputException e) {
            log.warn("Rejected slash command body: {}", e.getMessage());
            return SlackCommandResponse.error(e.getMessage());
        }

        try {
            return commandService.handle(request);
        } catch (InvalidInputException | ResourceNotFoundException e) {
            log.warn("Rejected slash command '{} {}': {}", request.getCommand(), request.getText(), e.getMessage());
            return SlackCommandResponse.error(e.getMessage());
        } catch (Exception e) {
            log.error("Failed to process slash command '{}' from team {}: {}", request.getCommand(), request.getTeamId(), e.getMessage(), e);
            return SlackCommandResponse.error(String.format("Can't process slack command: %s %s\n%s",
                    request.getCommand(), request.getText(), e.getMessage()));
        }
    }

    @GetMapping("/oauth/callback")
    public ResponseEntity<String> oauthCallback(@RequestParam(required = false) String code) {
        if (code == null || code.isBlank()) {
            return ResponseEntity.badRequest().body("Invalid request");
        }

        var installation = installationService.completeOAuth(code);
        log.info("Completed Slack OAuth for team {}", installation.getTeamId());
        return ResponseEntity.ok("Received slack oauth callback.");
    }
}
