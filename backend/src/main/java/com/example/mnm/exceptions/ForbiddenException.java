package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the caller is authenticated but the ownership rule does not grant the operation.
 * Mapped to 403 Forbidden.
 */
public class ForbiddenException extends ApiException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message);
    }
}
