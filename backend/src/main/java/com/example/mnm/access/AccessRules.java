package com.example.mnm.access;

import com.example.mnm.auth.UserRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.mnm.access.Access.NONE;
import static com.example.mnm.access.Access.READ;
import static com.example.mnm.access.Access.READ_WRITE;

/**
 * Ownership rule of every {@link ResourceCollection}. Construction fails if a collection
 * has no rule, so a new collection cannot ship unguarded.
 */
@Component
public class AccessRules {

    private static final Logger log = LoggerFactory.getLogger(AccessRules.class);

    static final String USER_ID = "userId";
    static final String CLIENT_ID = "clientId";
    static final String PROFESSIONAL_ID = "professionalId";

    private final Map<ResourceCollection, OwnershipRule> rules;

    public AccessRules() {
        this(defaultRules());
    }

    AccessRules(Map<ResourceCollection, OwnershipRule> rules) {
        Set<ResourceCollection> missing = EnumSet.allOf(ResourceCollection.class);
        missing.removeAll(rules.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No ownership rule declared for " + missing);
        }
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
        this.rules.forEach((collection, rule) ->
                log.info("Access rule {} -> {} (owners {})", collection.path(), rule.descriptor(), rule.ownerFields()));
    }

    public OwnershipRule ruleFor(ResourceCollection collection) {
        return rules.get(collection);
    }

    private static Map<ResourceCollection, OwnershipRule> defaultRules() {
        Map<ResourceCollection, OwnershipRule> rules = new EnumMap<>(ResourceCollection.class);
        // a user record is owned by the user it describes; created only by registration
        rules.put(ResourceCollection.USERS,
                OwnershipRule.ownedBy("id", READ_WRITE, NONE, NONE).notCreatable());
        rules.put(ResourceCollection.CLIENTS,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, NONE, READ));
        rules.put(ResourceCollection.PROFESSIONALS,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, NONE, READ));
        rules.put(ResourceCollection.PORTFOLIOS,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, NONE, READ).createdBy(UserRole.PROFESSIONAL));
        rules.put(ResourceCollection.SERVICES,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, READ, NONE).createdBy(UserRole.CLIENT));
        // both parties of a service request own it
        rules.put(ResourceCollection.CONTRACTS,
                new OwnershipRule(READ_WRITE, NONE, NONE, List.of(CLIENT_ID, PROFESSIONAL_ID), true, UserRole.CLIENT));
        rules.put(ResourceCollection.NOTIFICATIONS,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, NONE, NONE));
        rules.put(ResourceCollection.FAVORITES,
                OwnershipRule.ownedBy(USER_ID, READ_WRITE, NONE, NONE));
        return rules;
    }
}
