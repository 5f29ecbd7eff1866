package com.forum.infrastructure.exception;

public class AuthenticationRequiredException extends BusinessException {

    public AuthenticationRequiredException(String action) {
        super("AUTHENTICATION_REQUIRED", "Sign in to " + action);
    }
}
