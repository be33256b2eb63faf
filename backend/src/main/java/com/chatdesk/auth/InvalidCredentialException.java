package com.chatdesk.auth;

/**
 * Thrown when a realtime credential cannot be turned into an active user.
 */
public class InvalidCredentialException extends RuntimeException {

    public InvalidCredentialException(String message) {
        super(message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
