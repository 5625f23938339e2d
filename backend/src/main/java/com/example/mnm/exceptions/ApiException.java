package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base class for every error this service reports to its callers.
 * Carries the HTTP status and the category string written into {@link ErrorResponse#getError()}.
 * Mapped by {@link com.example.mnm.GlobalExceptionHandler}.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String category;

    protected ApiException(HttpStatus status, String category, String message) {
        super(message);
        this.status = status;
        this.category = category;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCategory() {
        return category;
    }

    /**
     * Extra fields flattened into the error body. Empty unless a subclass has something to add.
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }

    public ErrorResponse toResponse() {
        return new ErrorResponse(status.value(), category, getMessage(), getDetails());
    }
}
