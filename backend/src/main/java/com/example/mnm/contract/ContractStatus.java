package com.example.mnm.contract;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle of a service request: {@code criado → aceito → em_andamento → concluido},
 * with {@code cancelado} reachable from every non-terminal state.
 */
public enum ContractStatus {
    CRIADO("criado"),
    ACEITO("aceito"),
    EM_ANDAMENTO("em_andamento"),
    CONCLUIDO("concluido"),
    CANCELADO("cancelado");

    private final String value;

    ContractStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Set<ContractStatus> successors() {
        return switch (this) {
            case CRIADO -> EnumSet.of(ACEITO, CANCELADO);
            case ACEITO -> EnumSet.of(EM_ANDAMENTO, CANCELADO);
            case EM_ANDAMENTO -> EnumSet.of(CONCLUIDO, CANCELADO);
            case CONCLUIDO, CANCELADO -> EnumSet.noneOf(ContractStatus.class);
        };
    }

    public boolean canTransitionTo(ContractStatus target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    /**
     * Exact, case-sensitive lookup; anything that is not one of the status strings is empty.
     */
    public static Optional<ContractStatus> fromValue(Object value) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equals(text))
                .findFirst();
    }

    public static List<String> validValues() {
        return Arrays.stream(values()).map(ContractStatus::value).toList();
    }
}
