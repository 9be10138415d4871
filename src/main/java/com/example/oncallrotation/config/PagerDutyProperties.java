package com.example.oncallrotation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * PagerDuty REST API configuration properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.pagerduty")
public class PagerDutyProperties {
    @NotBlank
    private String baseUrl = "https://api.pagerduty.com";
    @Min(1)
    private int timeoutSeconds = 10;
}
