package com.example.oncallrotation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * On-Call Rotation Service Application
 * <p>
 * Keeps Slack user groups in sync with PagerDuty on-call schedules.
 * <p>
 * Features:
 * - Per-task cron schedules evaluated in each team's timezone
 * - A single EventBridge one-shot trigger waking the service for the earliest due task
 * - Slack slash commands to register and list rotations
 * - Tokens encrypted at rest
 */
@EnableScheduling
@SpringBootApplication
public class OncallRotationApplication {

    public static void main(String[] args) {
        SpringApplication.run(OncallRotationApplication.class, args);
    }
}
