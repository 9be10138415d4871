package com.example.oncallrotation.config;

import com.example.oncallrotation.crypto.TokenEncryptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CryptoConfig {

    @Bean
    public TokenEncryptor tokenEncryptor(OncallRotationProperties properties, ObjectMapper objectMapper) {
        return new TokenEncryptor(properties.getEncryptionKey(), objectMapper);
    }
}
