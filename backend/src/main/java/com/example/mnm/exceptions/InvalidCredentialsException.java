package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when login fails. Unknown identity and wrong secret both use this exception
 * with the same message.
 * Mapped to 401 Unauthorized.
 */
public class InvalidCredentialsException extends ApiException {

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials");
    }
}
