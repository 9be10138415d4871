package com.example.oncallrotation.exception;

import lombok.Getter;

/**
 * Exception for external service communication failures (PagerDuty, Slack)
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;
    private final Integer httpStatusCode;
    private final String responseBody;

    /**
     * Error code reported by the remote API, e.g. Slack's {@code users_not_found}
     */
    private final String errorCode;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.errorCode = null;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.errorCode = null;
    }

    public ExternalServiceException(String serviceName, String message, Exception cause) {
        super(String.format("[%s] %s", serviceName, message), cause);
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.errorCode = null;
    }

    public ExternalServiceException(String serviceName, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", serviceName, httpStatusCode, responseBody));
        this.serviceName = serviceName;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        this.errorCode = null;
    }

    public ExternalServiceException(String serviceName, String operation, String errorCode) {
        super(String.format("[%s] %s failed: %s", serviceName, operation, errorCode));
        this.serviceName = serviceName;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.errorCode = errorCode;
    }
}
