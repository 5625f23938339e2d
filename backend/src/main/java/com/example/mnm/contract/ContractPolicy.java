package com.example.mnm.contract;

import com.example.mnm.config.ContractProps;
import com.example.mnm.exceptions.InvalidRatingException;
import com.example.mnm.exceptions.InvalidStatusException;
import com.example.mnm.exceptions.InvalidTransitionException;
import com.example.mnm.exceptions.RatingNotAllowedException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validation rules for contract status and rating fields, shared by the dedicated lifecycle
 * endpoints and by generic contract updates.
 */
@Component
public class ContractPolicy {

    public static final String STATUS = "status";
    public static final String RATING = "rating";
    public static final String COMMENT = "comment";
    public static final String ACCEPTED_AT = "acceptedAt";
    public static final String COMPLETED_AT = "completedAt";
    public static final String RATED_AT = "ratedAt";

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final ContractProps props;

    public ContractPolicy(ContractProps props) {
        this.props = props;
    }

    /**
     * @throws InvalidStatusException if {@code requested} is not one of the status strings
     */
    public ContractStatus requireStatus(Object requested) {
        return ContractStatus.fromValue(requested)
                .orElseThrow(() -> new InvalidStatusException(requested, ContractStatus.validValues()));
    }

    /**
     * Only checked when transitions are enforced. A stored status that is missing or unknown
     * counts as {@code criado}.
     *
     * @throws InvalidTransitionException if {@code target} is not a successor of the current status
     */
    public void checkTransition(Object currentStatus, ContractStatus target) {
        if (!props.isEnforceTransitions()) {
            return;
        }
        ContractStatus current = ContractStatus.fromValue(currentStatus).orElse(ContractStatus.CRIADO);
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current.value(), target.value(),
                    current.successors().stream().map(ContractStatus::value).toList());
        }
    }

    /**
     * Fields written when a contract enters {@code target} at {@code now}.
     */
    public Map<String, Object> statusChanges(ContractStatus target, String now) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(STATUS, target.value());
        if (target == ContractStatus.ACEITO) {
            changes.put(ACCEPTED_AT, now);
        } else if (target == ContractStatus.CONCLUIDO) {
            changes.put(COMPLETED_AT, now);
        }
        return changes;
    }

    /**
     * Whole number from 1 to 5, given as a JSON number or a numeric string.
     *
     * @throws InvalidRatingException otherwise
     */
    public int requireRating(Object rating) {
        BigDecimal value = toDecimal(rating);
        if (value == null) {
            throw new InvalidRatingException("Rating is required and must be a number between "
                    + MIN_RATING + " and " + MAX_RATING);
        }
        if (value.stripTrailingZeros().scale() > 0) {
            throw new InvalidRatingException("Rating must be a whole number");
        }
        if (value.compareTo(BigDecimal.valueOf(MIN_RATING)) < 0 || value.compareTo(BigDecimal.valueOf(MAX_RATING)) > 0) {
            throw new InvalidRatingException("Rating must be between " + MIN_RATING + " and " + MAX_RATING);
        }
        return value.intValueExact();
    }

    /**
     * Only checked when rating rules are enforced.
     *
     * @throws RatingNotAllowedException if the contract is unfinished or already rated
     */
    public void checkRatingAllowed(Map<String, Object> contract) {
        if (!props.isEnforceRatingRules()) {
            return;
        }
        if (ContractStatus.fromValue(contract.get(STATUS)).orElse(null) != ContractStatus.CONCLUIDO) {
            throw new RatingNotAllowedException("Only finished contracts can be rated");
        }
        if (contract.get(RATING) != null) {
            throw new RatingNotAllowedException("Contract has already been rated");
        }
    }

    private BigDecimal toDecimal(Object rating) {
        if (rating instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (rating instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
