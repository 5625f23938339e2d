package com.example.mnm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Strictness switches for the contract lifecycle. Both default to the permissive behavior
 * clients already rely on.
 */
@Component
@ConfigurationProperties(prefix = "app.contracts")
public class ContractProps {

    /** Reject status changes that skip a step of the lifecycle. */
    private boolean enforceTransitions;

    /** Accept a rating only once, and only for a finished contract. */
    private boolean enforceRatingRules;

    public boolean isEnforceTransitions() {
        return enforceTransitions;
    }

    public void setEnforceTransitions(boolean enforceTransitions) {
        this.enforceTransitions = enforceTransitions;
    }

    public boolean isEnforceRatingRules() {
        return enforceRatingRules;
    }

    public void setEnforceRatingRules(boolean enforceRatingRules) {
        this.enforceRatingRules = enforceRatingRules;
    }
}
