package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a registration payload does not meet the identity or secret policy.
 * Mapped to 400 Bad Request.
 */
public class InvalidCredentialFormatException extends ApiException {

    public InvalidCredentialFormatException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_CREDENTIAL_FORMAT", message);
    }
}
