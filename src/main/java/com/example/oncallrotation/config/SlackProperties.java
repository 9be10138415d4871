package com.example.oncallrotation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Slack app configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {

    @NotBlank
    private String signingSecret;

    private String clientId;
    private String clientSecret;

    /**
     * Maximum age of a signed slash command request
     */
    @Min(1)
    private long requestToleranceSeconds = 300;
}
