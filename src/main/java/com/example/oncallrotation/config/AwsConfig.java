package com.example.oncallrotation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.scheduler.SchedulerClient;

/**
 * AWS clients. Credentials come from the default provider chain.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Bean
    public SchedulerClient schedulerClient(TriggerSchedulerProperties properties) {
        log.info("Creating EventBridge Scheduler client for region {}", properties.getRegion());

        return SchedulerClient.builder()
                .region(Region.of(properties.getRegion()))
                .build();
    }
}
