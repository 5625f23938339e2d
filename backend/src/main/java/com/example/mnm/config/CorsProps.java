package com.example.mnm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Browser origins allowed to call the API; {@code *} allows any origin. Cross-origin
 * credentials (cookies) are never allowed.
 */
@Component
@ConfigurationProperties(prefix = "app.cors")
public class CorsProps {

    private List<String> origins = new ArrayList<>();

    /** How long browsers may cache a preflight answer. */
    private Duration preflightMaxAge = Duration.ofHours(1);

    public List<String> getOrigins() {
        return origins;
    }

    public void setOrigins(List<String> origins) {
        this.origins = origins != null ? new ArrayList<>(origins) : new ArrayList<>();
    }

    public Duration getPreflightMaxAge() {
        return preflightMaxAge;
    }

    public void setPreflightMaxAge(Duration preflightMaxAge) {
        this.preflightMaxAge = preflightMaxAge != null ? preflightMaxAge : Duration.ofHours(1);
    }

    public boolean allowsAnyOrigin() {
        return origins.contains("*");
    }
}
