package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * Thrown when strict transitions are enabled and the requested status is not reachable
 * from the current one. Mapped to 409 Conflict.
 */
public class InvalidTransitionException extends ApiException {

    private final String from;
    private final List<String> allowed;

    public InvalidTransitionException(String from, String to, List<String> allowed) {
        super(HttpStatus.CONFLICT, "INVALID_TRANSITION",
                "Cannot move contract from '" + from + "' to '" + to + "'");
        this.from = from;
        this.allowed = List.copyOf(allowed);
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("currentStatus", from, "allowedStatus", allowed);
    }
}
