package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when an operation needs an identity and the request carries no valid bearer token.
 * Mapped to 401 Unauthorized.
 */
public class UnauthenticatedException extends ApiException {

    public UnauthenticatedException(String message) {
        super(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", message);
    }
}
