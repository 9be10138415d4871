package com.example.oncallrotation.domain.converter;

import com.example.oncallrotation.crypto.TokenEncryptor;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Encrypts token columns on write and decrypts them on read
 */
@Component
@Converter
@RequiredArgsConstructor
public class EncryptedTokenConverter implements AttributeConverter<String, String> {

    private final TokenEncryptor tokenEncryptor;

    @Override
    public String convertToDatabaseColumn(String token) {
        return token == null ? null : tokenEncryptor.encrypt(token);
    }

    @Override
    public String convertToEntityAttribute(String stored) {
        return stored == null ? null : tokenEncryptor.decrypt(stored);
    }
}
