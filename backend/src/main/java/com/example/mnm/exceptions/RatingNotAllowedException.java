package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when rating rules are enforced and the contract is not finished or is already rated.
 * Mapped to 409 Conflict.
 */
public class RatingNotAllowedException extends ApiException {

    public RatingNotAllowedException(String message) {
        super(HttpStatus.CONFLICT, "RATING_NOT_ALLOWED", message);
    }
}
