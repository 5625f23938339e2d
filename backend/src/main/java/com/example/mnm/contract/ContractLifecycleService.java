package com.example.mnm.contract;

import com.example.mnm.access.AccessControlEngine;
import com.example.mnm.access.ResourceCollection;
import com.example.mnm.auditlog.SecurityAuditService;
import com.example.mnm.dto.ContractDtos.RatingResponse;
import com.example.mnm.dto.ContractDtos.StatusChangeResponse;
import com.example.mnm.exceptions.RecordNotFoundException;
import com.example.mnm.exceptions.UnauthenticatedException;
import com.example.mnm.record.RecordTimestamps;
import com.example.mnm.security.AuthenticatedUser;
import com.example.mnm.store.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Status changes and rating submissions on contracts. Either party of a contract may call
 * them; the result is written back to the store.
 */
@Service
@RequiredArgsConstructor
public class ContractLifecycleService {

    private static final ResourceCollection CONTRACTS = ResourceCollection.CONTRACTS;

    private final RecordStore store;
    private final AccessControlEngine accessControl;
    private final ContractPolicy policy;
    private final RecordTimestamps timestamps;
    private final SecurityAuditService auditService;

    public StatusChangeResponse changeStatus(String contractId, Object requestedStatus,
                                             Optional<AuthenticatedUser> caller) {
        requireCaller(caller);
        ContractStatus target = policy.requireStatus(requestedStatus);
        Map<String, Object> contract = loadWritable(contractId, caller);
        Object current = contract.get(ContractPolicy.STATUS);
        policy.checkTransition(current, target);

        String updatedAt = timestamps.nextUpdatedAt(contract.get(RecordTimestamps.UPDATED_AT), null);
        Map<String, Object> changes = policy.statusChanges(target, updatedAt);
        changes.put(RecordTimestamps.UPDATED_AT, updatedAt);
        persist(contractId, changes);

        auditService.recordContractStatusChange(caller.get().id(), contractId,
                current != null ? current.toString() : null, target.value());
        return new StatusChangeResponse("Status updated to: " + target.value(), target.value(), updatedAt);
    }

    public RatingResponse rate(String contractId, Object rating, String comment,
                               Optional<AuthenticatedUser> caller) {
        requireCaller(caller);
        int value = policy.requireRating(rating);
        Map<String, Object> contract = loadWritable(contractId, caller);
        policy.checkRatingAllowed(contract);

        String updatedAt = timestamps.nextUpdatedAt(contract.get(RecordTimestamps.UPDATED_AT), null);
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(ContractPolicy.RATING, value);
        changes.put(ContractPolicy.COMMENT, comment);
        changes.put(ContractPolicy.RATED_AT, updatedAt);
        changes.put(RecordTimestamps.UPDATED_AT, updatedAt);
        persist(contractId, changes);

        return new RatingResponse("Rating recorded", value, comment, updatedAt);
    }

    private void requireCaller(Optional<AuthenticatedUser> caller) {
        if (caller.isEmpty()) {
            throw new UnauthenticatedException("Authentication required for " + CONTRACTS.path());
        }
    }

    private Map<String, Object> loadWritable(String contractId, Optional<AuthenticatedUser> caller) {
        Map<String, Object> contract = store.get(CONTRACTS.path(), contractId)
                .orElseThrow(() -> new RecordNotFoundException(CONTRACTS.path(), contractId));
        accessControl.checkWrite(CONTRACTS, contract, caller);
        return contract;
    }

    private void persist(String contractId, Map<String, Object> changes) {
        store.update(CONTRACTS.path(), contractId, changes)
                .orElseThrow(() -> new RecordNotFoundException(CONTRACTS.path(), contractId));
    }
}
