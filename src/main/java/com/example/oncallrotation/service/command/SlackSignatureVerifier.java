package com.example.oncallrotation.service.command;

import com.example.oncallrotation.config.SlackProperties;
import com.example.oncallrotation.exception.InvalidSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Verifies Slack's request signature: {@code v0=hex(HMAC-SHA256(signingSecret, "v0:" + timestamp + ":" + body))}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlackSignatureVerifier {

    private static final String VERSION = "v0";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SlackProperties slackProperties;
    private final Clock clock;

    /**
     * @throws InvalidSignatureException if the headers are missing, the request is too old or the signature differs
     */
    public void verify(String timestampHeader, String signatureHeader, String body) {
        if (timestampHeader == null || signatureHeader == null) {
            throw new InvalidSignatureException("Missing Slack signature headers");
        }

        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException e) {
            throw new InvalidSignatureException("Invalid request timestamp: " + timestampHeader);
        }

        var age = Math.abs(clock.instant().getEpochSecond() - timestamp);
        if (age > slackProperties.getRequestToleranceSeconds()) {
            throw new InvalidSignatureException(String.format("Request timestamp %d is %d seconds off", timestamp, age));
        }

        var expected = sign(timestamp, body == null ? "" : body);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), signatureHeader.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Slack signature mismatch for request at {}", timestamp);
            throw new InvalidSignatureException("Signature mismatch");
        }
    }

    String sign(long timestamp, String body) {
        try {
            var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(slackProperties.getSigningSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            var digest = mac.doFinal(String.format("%s:%d:%s", VERSION, timestamp, body).getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
