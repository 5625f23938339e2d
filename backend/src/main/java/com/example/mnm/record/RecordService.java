package com.example.mnm.record;

import com.example.mnm.access.AccessControlEngine;
import com.example.mnm.access.OwnershipRule;
import com.example.mnm.access.ResourceCollection;
import com.example.mnm.auth.AuthService;
import com.example.mnm.auth.UserRole;
import com.example.mnm.contract.ContractPolicy;
import com.example.mnm.contract.ContractStatus;
import com.example.mnm.exceptions.ForbiddenException;
import com.example.mnm.exceptions.InvalidRatingException;
import com.example.mnm.exceptions.InvalidRecordException;
import com.example.mnm.exceptions.InvalidStatusException;
import com.example.mnm.exceptions.RecordNotFoundException;
import com.example.mnm.security.AuthenticatedUser;
import com.example.mnm.store.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.example.mnm.record.RecordTimestamps.CREATED_AT;
import static com.example.mnm.record.RecordTimestamps.UPDATED_AT;

/**
 * List/get/create/replace/patch/delete over every collection, with the ownership rules
 * applied and the record invariants kept: ids, owner fields and {@code createdAt} never
 * change after creation, and {@code updatedAt} strictly increases on every write.
 */
@Service
@RequiredArgsConstructor
public class RecordService {

    private static final List<String> LIFECYCLE_FIELDS =
            List.of(ContractPolicy.ACCEPTED_AT, ContractPolicy.COMPLETED_AT, ContractPolicy.RATED_AT);

    private final RecordStore store;
    private final AccessControlEngine accessControl;
    private final RecordTimestamps timestamps;
    private final AuthService authService;
    private final ContractPolicy contractPolicy;

    public List<Map<String, Object>> list(ResourceCollection collection, Map<String, String> filter,
                                          Optional<AuthenticatedUser> caller) {
        var visible = accessControl.listScope(collection, caller);
        return store.list(collection.path(), filter).stream()
                .filter(visible)
                .map(record -> present(collection, record))
                .toList();
    }

    public Map<String, Object> get(ResourceCollection collection, String id, Optional<AuthenticatedUser> caller) {
        Map<String, Object> record = load(collection, id);
        accessControl.checkRead(collection, record, caller);
        return present(collection, record);
    }

    public Map<String, Object> create(ResourceCollection collection, Map<String, Object> payload,
                                      Optional<AuthenticatedUser> caller) {
        AuthenticatedUser creator = accessControl.checkCreate(collection, caller);
        OwnershipRule rule = accessControl.ruleFor(collection);

        Map<String, Object> record = new LinkedHashMap<>(payload);
        record.remove(RecordStore.ID);
        if (!record.containsKey(CREATED_AT) || !record.containsKey(UPDATED_AT)) {
            timestamps.stampCreated(record);
        } else {
            record.put(UPDATED_AT, record.get(CREATED_AT));
        }
        record.put(rule.primaryOwnerField(), creator.id());

        if (collection == ResourceCollection.CONTRACTS) {
            prepareNewContract(record, creator);
        }
        return present(collection, store.create(collection.path(), record));
    }

    public Map<String, Object> replace(ResourceCollection collection, String id, Map<String, Object> payload,
                                       Optional<AuthenticatedUser> caller) {
        return write(collection, id, payload, caller, true);
    }

    public Map<String, Object> patch(ResourceCollection collection, String id, Map<String, Object> payload,
                                     Optional<AuthenticatedUser> caller) {
        return write(collection, id, payload, caller, false);
    }

    public void delete(ResourceCollection collection, String id, Optional<AuthenticatedUser> caller) {
        Map<String, Object> record = load(collection, id);
        accessControl.checkWrite(collection, record, caller);
        if (collection == ResourceCollection.USERS) {
            throw new ForbiddenException("User accounts cannot be deleted");
        }
        if (!store.delete(collection.path(), id)) {
            throw new RecordNotFoundException(collection.path(), id);
        }
    }

    private Map<String, Object> write(ResourceCollection collection, String id, Map<String, Object> payload,
                                      Optional<AuthenticatedUser> caller, boolean replace) {
        Map<String, Object> existing = load(collection, id);
        accessControl.checkWrite(collection, existing, caller);

        Map<String, Object> changes = new LinkedHashMap<>(payload);
        changes.remove(RecordStore.ID);
        changes.remove(CREATED_AT);
        for (String ownerField : accessControl.ruleFor(collection).ownerFields()) {
            changes.remove(ownerField);
        }
        changes.put(UPDATED_AT, timestamps.nextUpdatedAt(existing.get(UPDATED_AT), payload.get(UPDATED_AT)));

        if (collection == ResourceCollection.USERS) {
            changes = authService.prepareUserChanges(existing, changes, replace);
        } else if (collection == ResourceCollection.CONTRACTS) {
            applyContractRules(existing, changes, replace);
        }

        Optional<Map<String, Object>> saved;
        if (replace) {
            Map<String, Object> replacement = new LinkedHashMap<>(changes);
            replacement.put(CREATED_AT, existing.get(CREATED_AT));
            for (String ownerField : accessControl.ruleFor(collection).ownerFields()) {
                if (existing.containsKey(ownerField)) {
                    replacement.put(ownerField, existing.get(ownerField));
                }
            }
            saved = store.replace(collection.path(), id, replacement);
        } else {
            saved = store.update(collection.path(), id, changes);
        }
        return present(collection, saved.orElseThrow(() -> new RecordNotFoundException(collection.path(), id)));
    }

    private void prepareNewContract(Map<String, Object> contract, AuthenticatedUser client) {
        Object professionalId = contract.get("professionalId");
        if (professionalId == null || professionalId.toString().isBlank()) {
            throw new InvalidRecordException("professionalId is required");
        }
        String professional = professionalId.toString();
        if (professional.equals(client.id())) {
            throw new InvalidRecordException("A contract needs two different parties");
        }
        boolean isProfessional = store.get(ResourceCollection.USERS.path(), professional)
                .map(user -> UserRole.fromValue(Objects.toString(user.get(AuthService.ROLE), null))
                        .filter(role -> role == UserRole.PROFESSIONAL)
                        .isPresent())
                .orElse(false);
        if (!isProfessional) {
            throw new InvalidRecordException("professionalId must reference a professional account");
        }
        contract.put("professionalId", professional);
        contract.put(ContractPolicy.STATUS, ContractStatus.CRIADO.value());
        contract.remove(ContractPolicy.RATING);
        contract.remove(ContractPolicy.RATED_AT);
        contract.remove(ContractPolicy.ACCEPTED_AT);
        contract.remove(ContractPolicy.COMPLETED_AT);
    }

    private void applyContractRules(Map<String, Object> existing, Map<String, Object> changes, boolean replace) {
        // lifecycle stamps are written by the server only
        for (String field : LIFECYCLE_FIELDS) {
            changes.remove(field);
            if (replace && existing.containsKey(field)) {
                changes.put(field, existing.get(field));
            }
        }

        // a partial update may not clear the lifecycle fields
        if (!replace && changes.containsKey(ContractPolicy.STATUS) && changes.get(ContractPolicy.STATUS) == null) {
            throw new InvalidStatusException(null, ContractStatus.validValues());
        }
        if (!replace && changes.containsKey(ContractPolicy.RATING) && changes.get(ContractPolicy.RATING) == null) {
            throw new InvalidRatingException("Rating cannot be cleared");
        }

        Object status = changes.get(ContractPolicy.STATUS);
        if (status != null && !status.equals(existing.get(ContractPolicy.STATUS))) {
            ContractStatus target = contractPolicy.requireStatus(status);
            contractPolicy.checkTransition(existing.get(ContractPolicy.STATUS), target);
            changes.putAll(contractPolicy.statusChanges(target, changes.get(UPDATED_AT).toString()));
        } else if (replace && status == null) {
            changes.put(ContractPolicy.STATUS, existing.get(ContractPolicy.STATUS));
        }

        Object rating = changes.get(ContractPolicy.RATING);
        if (rating != null && !rating.equals(existing.get(ContractPolicy.RATING))) {
            int value = contractPolicy.requireRating(rating);
            contractPolicy.checkRatingAllowed(existing);
            changes.put(ContractPolicy.RATING, value);
            changes.put(ContractPolicy.RATED_AT, changes.get(UPDATED_AT));
        } else if (replace && rating == null && existing.get(ContractPolicy.RATING) != null) {
            changes.put(ContractPolicy.RATING, existing.get(ContractPolicy.RATING));
        }
    }

    private Map<String, Object> load(ResourceCollection collection, String id) {
        return store.get(collection.path(), id)
                .orElseThrow(() -> new RecordNotFoundException(collection.path(), id));
    }

    private Map<String, Object> present(ResourceCollection collection, Map<String, Object> record) {
        return collection == ResourceCollection.USERS ? AuthService.withoutSecrets(record) : record;
    }
}
