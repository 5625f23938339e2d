package com.example.mnm.exceptions;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a required query parameter is absent. The body lists every required name
 * and a sample request.
 */
public class MissingParameterException extends ApiException {

    private final List<String> required;
    private final String example;

    public MissingParameterException(List<String> required, String example) {
        super(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
                "Required parameters: " + String.join(", ", required));
        this.required = List.copyOf(required);
        this.example = example;
    }

    public List<String> getRequired() {
        return required;
    }

    public String getExample() {
        return example;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("example", example);
        return details;
    }
}
