package com.example.mnm.access;

import com.example.mnm.auth.UserRole;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Who may do what with the records of one collection.
 *
 * @param owner        capabilities of the identities named by {@code ownerFields}
 * @param related      extra capabilities of any other authenticated caller
 * @param everyone     capabilities of every caller, anonymous included
 * @param ownerFields  record fields holding owner user ids; the first is stamped with the creator's id
 * @param creatable    whether the generic create operation is open for this collection
 * @param creatorRole  role required to create, or {@code null} for any authenticated caller
 */
public record OwnershipRule(Access owner,
                            Access related,
                            Access everyone,
                            List<String> ownerFields,
                            boolean creatable,
                            UserRole creatorRole) {

    public OwnershipRule {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(related, "related");
        Objects.requireNonNull(everyone, "everyone");
        if (ownerFields == null || ownerFields.isEmpty()) {
            throw new IllegalArgumentException("an ownership rule needs at least one owner field");
        }
        ownerFields = List.copyOf(ownerFields);
    }

    public static OwnershipRule ownedBy(String ownerField, Access owner, Access related, Access everyone) {
        return new OwnershipRule(owner, related, everyone, List.of(ownerField), true, null);
    }

    public OwnershipRule createdBy(UserRole role) {
        return new OwnershipRule(owner, related, everyone, ownerFields, creatable, role);
    }

    public OwnershipRule notCreatable() {
        return new OwnershipRule(owner, related, everyone, ownerFields, false, creatorRole);
    }

    public String primaryOwnerField() {
        return ownerFields.get(0);
    }

    public Optional<UserRole> requiredCreatorRole() {
        return Optional.ofNullable(creatorRole);
    }

    /**
     * Three-digit descriptor, e.g. {@code 644}.
     */
    public String descriptor() {
        return "" + owner.digit() + related.digit() + everyone.digit();
    }
}
