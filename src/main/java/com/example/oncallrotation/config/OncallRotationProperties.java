package com.example.oncallrotation.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for rotation runs.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "oncall-rotation")
public class OncallRotationProperties {

    /**
     * Number of due tasks synced concurrently
     */
    @Min(1)
    private int syncPoolSize = 8;

    /**
     * Length of the window PagerDuty is asked about, starting at the run instant
     */
    @Min(1)
    private int syncWindowMinutes = 10;

    /**
     * How many more members than on-call users a group may have before it is flagged
     */
    @Min(0)
    private int oversizedGroupMargin = 2;

    @NotNull
    private OversizedGroupPolicy oversizedGroupPolicy = OversizedGroupPolicy.WARN;

    /**
     * Symmetric key for tokens at rest, exactly 32 UTF-8 bytes
     */
    @NotNull
    @Size(min = 32, max = 32)
    private String encryptionKey;

    /**
     * Interval for refreshing task gauges
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    public enum OversizedGroupPolicy {
        /**
         * Log and continue with the update
         */
        WARN,
        /**
         * Log and abort the sync for that task
         */
        ABORT
    }
}
