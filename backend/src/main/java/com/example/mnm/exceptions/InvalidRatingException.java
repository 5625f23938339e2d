package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a rating is missing or falls outside the accepted range.
 */
public class InvalidRatingException extends ApiException {

    public InvalidRatingException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_RATING", message);
    }
}
