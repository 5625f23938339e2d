package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Thrown when a query parameter is present but cannot be used (not numeric, out of range).
 */
public class InvalidParameterException extends ApiException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("parameter", parameter);
    }
}
