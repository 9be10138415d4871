package com.example.oncallrotation.exception;

import lombok.Getter;

/**
 * Exception for a missing installation or token needed to act on behalf of a team
 */
@Getter
public class CredentialException extends RuntimeException {

    private final String teamId;

    public CredentialException(String teamId, String message) {
        super(String.format("Team %s: %s", teamId, message));
        this.teamId = teamId;
    }
}
