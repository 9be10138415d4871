package com.example.oncallrotation.crypto;

import com.example.oncallrotation.exception.TokenCryptoException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Authenticated encryption for tokens stored at rest.
 * <p>
 * Uses ChaCha20-Poly1305 with a fresh random 12-byte nonce per message. The stored form is the JSON
 * document {@code {"nonce": "...", "data": "..."}} with both values in unpadded base64, where
 * {@code data} is ciphertext followed by the authentication tag.
 */
public class TokenEncryptor {

    private static final String CIPHER = "ChaCha20-Poly1305";
    private static final String KEY_ALGORITHM = "ChaCha20";
    private static final int KEY_LENGTH = 32;
    private static final int NONCE_LENGTH = 12;

    private final SecretKeySpec key;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    private final Base64.Encoder encoder = Base64.getEncoder().withoutPadding();
    private final Base64.Decoder decoder = Base64.getDecoder();

    public TokenEncryptor(String key, ObjectMapper objectMapper) {
        if (key == null) {
            throw new TokenCryptoException("Encryption key is not configured");
        }
        var keyBytes = key.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length != KEY_LENGTH) {
            throw new TokenCryptoException(String.format("Encryption key must be %d bytes but is %d", KEY_LENGTH, keyBytes.length));
        }
        this.key = new SecretKeySpec(keyBytes, KEY_ALGORITHM);
        this.objectMapper = objectMapper;
    }

    public String encrypt(String plaintext) {
        var nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);

        try {
            var cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(nonce));
            var data = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            return objectMapper.writeValueAsString(new EncryptedPayload(encoder.encodeToString(nonce), encoder.encodeToString(data)));
        } catch (GeneralSecurityException | JsonProcessingException e) {
            throw new TokenCryptoException("Failed to encrypt token", e);
        }
    }

    /**
     * @throws TokenCryptoException on a wrong key, tampered data or a malformed payload
     */
    public String decrypt(String stored) {
        try {
            var payload = objectMapper.readValue(stored, EncryptedPayload.class);
            if (payload.getNonce() == null || payload.getData() == null) {
                throw new TokenCryptoException("Encrypted token is missing nonce or data");
            }

            var nonce = decoder.decode(payload.getNonce());
            if (nonce.length != NONCE_LENGTH) {
                throw new TokenCryptoException(String.format("Nonce must be %d bytes but is %d", NONCE_LENGTH, nonce.length));
            }

            var cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(nonce));

            return new String(cipher.doFinal(decoder.decode(payload.getData())), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | JsonProcessingException | IllegalArgumentException e) {
            throw new TokenCryptoException("Failed to decrypt token", e);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class EncryptedPayload {
        private String nonce;
        private String data;
    }
}
