package com.example.mnm.store;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRecordStoreTest {

    private final InMemoryRecordStore store = new InMemoryRecordStore();

    @Test
    void createAssignsSequentialIdsPerCollectionAndIgnoresClientIds() {
        Map<String, Object> first = store.create("services", Map.of("id", "99", "title", "Leak"));
        Map<String, Object> second = store.create("services", Map.of("title", "Paint"));
        Map<String, Object> other = store.create("favorites", Map.of("userId", "1"));

        assertThat(first).containsEntry("id", "1").containsEntry("title", "Leak");
        assertThat(second).containsEntry("id", "2");
        assertThat(other).containsEntry("id", "1");
    }

    @Test
    void listFiltersByFieldEqualityOnStringForm() {
        store.create("portfolios", Map.of("userId", "7", "featured", true, "price", 120));
        store.create("portfolios", Map.of("userId", "8", "featured", false, "price", 80));

        assertThat(store.list("portfolios", Map.of())).hasSize(2);
        assertThat(store.list("portfolios", Map.of("userId", "7")))
                .singleElement()
                .satisfies(record -> assertThat(record).containsEntry("price", 120));
        assertThat(store.list("portfolios", Map.of("featured", "false", "price", "80"))).hasSize(1);
        assertThat(store.list("portfolios", Map.of("missing", "x"))).isEmpty();
    }

    @Test
    void returnedRecordsAreCopies() {
        Map<String, Object> created = store.create("clients", Map.of("name", "Ana"));
        created.put("name", "changed");

        Map<String, Object> fetched = store.get("clients", "1").orElseThrow();
        fetched.put("name", "changed again");

        assertThat(store.get("clients", "1").orElseThrow()).containsEntry("name", "Ana");
    }

    @Test
    void replaceDropsFieldsAndUpdateMergesThem() {
        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put("description", "Broken pipe");
        initial.put("budget", 200);
        store.create("contracts", initial);

        Map<String, Object> replaced = store.replace("contracts", "1", Map.of("description", "New pipe")).orElseThrow();
        assertThat(replaced).containsOnlyKeys("id", "description");

        Map<String, Object> patch = new HashMap<>();
        patch.put("budget", 300);
        patch.put("id", "42");
        Map<String, Object> updated = store.update("contracts", "1", patch).orElseThrow();
        assertThat(updated)
                .containsEntry("id", "1")
                .containsEntry("description", "New pipe")
                .containsEntry("budget", 300);
    }

    @Test
    void missingRecordsAreReportedAsEmptyOrFalse() {
        assertThat(store.get("users", "1")).isEmpty();
        assertThat(store.get("users", null)).isEmpty();
        assertThat(store.replace("users", "1", Map.of())).isEmpty();
        assertThat(store.update("users", "1", Map.of())).isEmpty();
        assertThat(store.delete("users", "1")).isFalse();
    }

    @Test
    void deleteRemovesTheRecordButKeepsTheSequence() {
        store.create("notifications", Map.of("text", "a"));
        assertThat(store.delete("notifications", "1")).isTrue();

        Map<String, Object> next = store.create("notifications", Map.of("text", "b"));

        assertThat(next).containsEntry("id", "2");
        assertThat(store.list("notifications", Map.of())).extracting(r -> r.get("text")).containsExactly("b");
    }
}
