package com.example.mnm.exceptions;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of every error response: {@code status}, the machine-checkable {@code error} category,
 * a human-readable {@code message}, plus any category-specific fields flattened alongside them
 * (for example {@code validStatus} or {@code example}).
 */
@JsonPropertyOrder({"status", "error", "message"})
public class ErrorResponse {

    private final int status;
    private final String error;
    private final String message;
    private final Map<String, Object> details;

    public ErrorResponse(int status, String error, String message) {
        this(status, error, message, Map.of());
    }

    public ErrorResponse(int status, String error, String message, Map<String, Object> details) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
