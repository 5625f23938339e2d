package com.example.mnm.access;

import com.example.mnm.auditlog.SecurityAuditService;
import com.example.mnm.auth.UserRole;
import com.example.mnm.exceptions.ApiException;
import com.example.mnm.exceptions.ForbiddenException;
import com.example.mnm.exceptions.UnauthenticatedException;
import com.example.mnm.security.AuthenticatedUser;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether a caller may read, write, list or create records of a collection.
 *
 * <p>Owners of a record get the owner tier of the collection's rule. Any other authenticated
 * caller gets the related tier together with the public tier; anonymous callers get the
 * public tier only. A refusal is {@link UnauthenticatedException} for anonymous callers and
 * {@link ForbiddenException} otherwise.
 */
@Service
public class AccessControlEngine {

    private final AccessRules rules;
    private final SecurityAuditService auditService;

    public AccessControlEngine(AccessRules rules, SecurityAuditService auditService) {
        this.rules = rules;
        this.auditService = auditService;
    }

    public OwnershipRule ruleFor(ResourceCollection collection) {
        return rules.ruleFor(collection);
    }

    /**
     * User ids named by the owner fields of {@code record}. Missing or blank fields are skipped.
     */
    public Set<String> ownersOf(ResourceCollection collection, Map<String, Object> record) {
        Set<String> owners = new LinkedHashSet<>();
        for (String field : rules.ruleFor(collection).ownerFields()) {
            Object value = record.get(field);
            if (value != null && !value.toString().isBlank()) {
                owners.add(value.toString());
            }
        }
        return owners;
    }

    public boolean isOwner(ResourceCollection collection, Map<String, Object> record, Optional<AuthenticatedUser> caller) {
        return caller.map(user -> ownersOf(collection, record).contains(user.id())).orElse(false);
    }

    public void checkRead(ResourceCollection collection, Map<String, Object> record, Optional<AuthenticatedUser> caller) {
        check(collection, record, caller, Operation.READ);
    }

    public void checkWrite(ResourceCollection collection, Map<String, Object> record, Optional<AuthenticatedUser> caller) {
        check(collection, record, caller, Operation.WRITE);
    }

    /**
     * Checks that {@code caller} may create a record in {@code collection} and returns it;
     * the caller becomes the record's owner.
     */
    public AuthenticatedUser checkCreate(ResourceCollection collection, Optional<AuthenticatedUser> caller) {
        OwnershipRule rule = rules.ruleFor(collection);
        if (caller.isEmpty()) {
            throw deny(collection, null, caller, "CREATE");
        }
        AuthenticatedUser user = caller.get();
        if (!rule.creatable()) {
            throw deny(collection, null, caller, "CREATE");
        }
        Optional<UserRole> requiredRole = rule.requiredCreatorRole();
        if (requiredRole.isPresent() && requiredRole.get() != user.role()) {
            auditService.recordAccessDenied(user.id(), collection.path(), null, "CREATE");
            throw new ForbiddenException("Only " + requiredRole.get().value() + " accounts can create "
                    + collection.path());
        }
        return user;
    }

    /**
     * Narrows a listing to what the caller may read. Collections readable by the caller's
     * non-owner tier are listed in full; otherwise authenticated callers see only their own
     * records and anonymous callers are refused.
     */
    public Predicate<Map<String, Object>> listScope(ResourceCollection collection, Optional<AuthenticatedUser> caller) {
        if (nonOwnerAccess(rules.ruleFor(collection), caller).read()) {
            return record -> true;
        }
        if (caller.isEmpty()) {
            throw deny(collection, null, caller, Operation.READ.name());
        }
        String userId = caller.get().id();
        return record -> ownersOf(collection, record).contains(userId);
    }

    private void check(ResourceCollection collection, Map<String, Object> record,
                       Optional<AuthenticatedUser> caller, Operation operation) {
        OwnershipRule rule = rules.ruleFor(collection);
        Access access = isOwner(collection, record, caller)
                ? rule.owner().union(nonOwnerAccess(rule, caller))
                : nonOwnerAccess(rule, caller);
        if (!access.allows(operation)) {
            Object id = record.get("id");
            throw deny(collection, id != null ? id.toString() : null, caller, operation.name());
        }
    }

    private Access nonOwnerAccess(OwnershipRule rule, Optional<AuthenticatedUser> caller) {
        return caller.isPresent() ? rule.related().union(rule.everyone()) : rule.everyone();
    }

    private ApiException deny(ResourceCollection collection, String recordId,
                              Optional<AuthenticatedUser> caller, String operation) {
        auditService.recordAccessDenied(caller.map(AuthenticatedUser::id).orElse(null),
                collection.path(), recordId, operation);
        if (caller.isEmpty()) {
            return new UnauthenticatedException("Authentication required for " + collection.path());
        }
        return new ForbiddenException("Not allowed to " + operation.toLowerCase(Locale.ROOT) + " "
                + collection.path() + (recordId != null ? "/" + recordId : ""));
    }

}
