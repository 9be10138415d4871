package com.example.oncallrotation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * EventBridge Scheduler settings for the one-shot wake-up triggers
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "oncall-rotation.trigger")
public class TriggerSchedulerProperties {

    /**
     * Every trigger owned by this service is named prefix + epoch seconds
     */
    @NotBlank
    private String namePrefix = "oncall-rotation-";

    /**
     * ARN of whatever the trigger invokes (e.g. an API destination calling /api/v1/rotations/run)
     */
    @NotBlank
    private String targetArn;

    @NotBlank
    private String targetRoleArn;

    /**
     * Triggers this many seconds in the past are still considered in flight
     */
    @Min(0)
    private long graceSeconds = 300;

    @NotBlank
    private String region = "us-east-1";
}
