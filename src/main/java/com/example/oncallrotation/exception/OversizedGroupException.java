package com.example.oncallrotation.exception;

import lombok.Getter;

/**
 * Exception raised when a target group holds far more members than the on-call roster
 */
@Getter
public class OversizedGroupException extends RuntimeException {

    private final String userGroupId;
    private final int currentSize;
    private final int desiredSize;

    public OversizedGroupException(String userGroupId, int currentSize, int desiredSize) {
        super(String.format("User group %s has %d members but only %d are on call", userGroupId, currentSize, desiredSize));
        this.userGroupId = userGroupId;
        this.currentSize = currentSize;
        this.desiredSize = desiredSize;
    }
}
