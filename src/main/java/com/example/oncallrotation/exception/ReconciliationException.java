package com.example.oncallrotation.exception;

import lombok.Getter;

/**
 * Exception raised when the external trigger namespace cannot be listed or changed
 */
@Getter
public class ReconciliationException extends RuntimeException {

    private final String triggerName;

    public ReconciliationException(String message, Exception cause) {
        super(message, cause);
        this.triggerName = null;
    }

    public ReconciliationException(String triggerName, String message, Exception cause) {
        super(String.format("Trigger %s: %s", triggerName, message), cause);
        this.triggerName = triggerName;
    }
}
