package com.example.mnm.access;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The named collections exposed over the CRUD surface. {@link #path()} is both the URL
 * segment and the store collection name.
 */
public enum ResourceCollection {
    USERS("users"),
    CLIENTS("clients"),
    PROFESSIONALS("professionals"),
    PORTFOLIOS("portfolios"),
    CONTRACTS("contracts"),
    SERVICES("services"),
    NOTIFICATIONS("notifications"),
    FAVORITES("favorites");

    /** Path-variable regex accepted by the CRUD controller; must list every constant. */
    public static final String PATH_PATTERN =
            "users|clients|professionals|portfolios|contracts|services|notifications|favorites";

    private final String path;

    ResourceCollection(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    public static Optional<ResourceCollection> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(collection -> collection.path.equals(path))
                .findFirst();
    }

    public static List<String> paths() {
        return Arrays.stream(values()).map(ResourceCollection::path).toList();
    }
}
