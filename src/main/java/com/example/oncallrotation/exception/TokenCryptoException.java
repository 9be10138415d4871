package com.example.oncallrotation.exception;

/**
 * Exception for tokens that cannot be encrypted or decrypted
 */
public class TokenCryptoException extends RuntimeException {

    public TokenCryptoException(String message) {
        super(message);
    }

    public TokenCryptoException(String message, Exception cause) {
        super(message, cause);
    }
}
