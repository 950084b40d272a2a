package com.keystone.auth;

/**
 * Raised by {@link Authenticator#refresh} when the stored session cannot be refreshed and a new
 * login is needed.
 */
public class ReauthenticationRequiredException extends RuntimeException {

    public ReauthenticationRequiredException(String message) {
        super(message);
    }
}
