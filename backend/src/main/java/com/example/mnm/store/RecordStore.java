package com.example.mnm.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-indexed document store: named collections of JSON-like records, each identified by
 * a string {@code id} field assigned by the store.
 *
 * <p>Records handed out are copies; mutating them does not change stored state.
 */
public interface RecordStore {

    String ID = "id";

    /**
     * Records of {@code collection} in insertion order whose fields equal every entry of
     * {@code filter} (compared by string form). An empty filter returns everything.
     */
    List<Map<String, Object>> list(String collection, Map<String, String> filter);

    Optional<Map<String, Object>> get(String collection, String id);

    /**
     * Stores {@code record} under a freshly assigned id, ignoring any id it carries.
     */
    Map<String, Object> create(String collection, Map<String, Object> record);

    /**
     * Replaces the stored record wholesale. The id is kept.
     */
    Optional<Map<String, Object>> replace(String collection, String id, Map<String, Object> record);

    /**
     * Merges {@code patch} into the stored record, field by field.
     */
    Optional<Map<String, Object>> update(String collection, String id, Map<String, Object> patch);

    boolean delete(String collection, String id);
}
