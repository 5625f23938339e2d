package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when registering an email that already belongs to a user.
 * Mapped to 409 Conflict.
 */
public class DuplicateIdentityException extends ApiException {

    public DuplicateIdentityException(String message) {
        super(HttpStatus.CONFLICT, "DUPLICATE_IDENTITY", message);
    }
}
