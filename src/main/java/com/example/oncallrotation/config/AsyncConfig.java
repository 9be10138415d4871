package com.example.oncallrotation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Worker pool for syncing due rotation tasks in parallel.
 * Its size bounds the fan-out towards PagerDuty and Slack within one run.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "rotationSyncExecutor", destroyMethod = "shutdown")
    public ExecutorService rotationSyncExecutor(OncallRotationProperties properties) {
        log.info("Creating rotation sync executor with {} threads", properties.getSyncPoolSize());

        return Executors.newFixedThreadPool(properties.getSyncPoolSize(), new CustomizableThreadFactory("rotation-sync-"));
    }
}
