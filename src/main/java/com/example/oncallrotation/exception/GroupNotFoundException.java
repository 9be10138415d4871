package com.example.oncallrotation.exception;

/**
 * The Slack user group named by a rotation task does not exist in the workspace
 */
public class GroupNotFoundException extends ResourceNotFoundException {

    public GroupNotFoundException(String nameOrHandle) {
        super("User group", nameOrHandle);
    }
}
