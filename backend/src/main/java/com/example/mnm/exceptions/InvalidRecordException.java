package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a record payload is missing a field or references something it may not.
 * Mapped to 400 Bad Request.
 */
public class InvalidRecordException extends ApiException {

    public InvalidRecordException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_RECORD", message);
    }
}
