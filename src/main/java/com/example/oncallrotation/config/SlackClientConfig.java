package com.example.oncallrotation.config;

import com.slack.api.Slack;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared Slack SDK entry point. Tokens are per workspace and supplied on each call.
 */
@Configuration
public class SlackClientConfig {

    @Bean
    public Slack slack() {
        return Slack.getInstance();
    }
}
