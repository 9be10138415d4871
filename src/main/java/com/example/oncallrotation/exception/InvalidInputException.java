package com.example.oncallrotation.exception;

import lombok.Getter;

/**
 * Exception for user supplied values that cannot be accepted (cron, timezone, command arguments)
 */
@Getter
public class InvalidInputException extends RuntimeException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
