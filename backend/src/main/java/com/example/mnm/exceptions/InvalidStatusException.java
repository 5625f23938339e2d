package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a contract status change names a value outside the status enumeration.
 * The body reports the accepted values under {@code validStatus}.
 */
public class InvalidStatusException extends ApiException {

    private final List<String> validStatus;

    public InvalidStatusException(Object requested, List<String> validStatus) {
        super(HttpStatus.BAD_REQUEST, "INVALID_STATUS",
                "Invalid status '" + requested + "'. Must be one of: " + String.join(", ", validStatus));
        this.validStatus = List.copyOf(validStatus);
    }

    public List<String> getValidStatus() {
        return validStatus;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("validStatus", validStatus);
    }
}
