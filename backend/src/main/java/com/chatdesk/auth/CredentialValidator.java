package com.chatdesk.auth;

/**
 * Validates the opaque credential a client presents in its authenticate event.
 */
public interface CredentialValidator {

    /**
     * @param credential access token sent by the client
     * @return the authenticated user and tenant
     * @throws InvalidCredentialException if the token is invalid or the user/tenant is inactive
     */
    AuthenticatedPrincipal validate(String credential);
}
