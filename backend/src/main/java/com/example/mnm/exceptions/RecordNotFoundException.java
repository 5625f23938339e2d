package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a record id does not exist in its collection.
 * Mapped to 404 Not Found.
 */
public class RecordNotFoundException extends ApiException {

    public RecordNotFoundException(String collection, String id) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", "No record '" + id + "' in " + collection);
    }
}
