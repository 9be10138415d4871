package com.example.oncallrotation.exception;

/**
 * Exception for inbound Slack requests whose signature or timestamp does not check out
 */
public class InvalidSignatureException extends RuntimeException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
