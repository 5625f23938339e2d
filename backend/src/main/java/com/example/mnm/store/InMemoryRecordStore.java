package com.example.mnm.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Repository
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "memory")
public class InMemoryRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    private final ConcurrentMap<String, Table> tables = new ConcurrentHashMap<>();

    @PostConstruct
    void logInitialization() {
        log.warn("Using in-memory record store; data is lost on restart. Set app.store.type=mongo to persist.");
    }

    @Override
    public List<Map<String, Object>> list(String collection, Map<String, String> filter) {
        return table(collection).list(filter);
    }

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return table(collection).get(id);
    }

    @Override
    public Map<String, Object> create(String collection, Map<String, Object> record) {
        return table(collection).create(record);
    }

    @Override
    public Optional<Map<String, Object>> replace(String collection, String id, Map<String, Object> record) {
        if (id == null) {
            return Optional.empty();
        }
        return table(collection).replace(id, record);
    }

    @Override
    public Optional<Map<String, Object>> update(String collection, String id, Map<String, Object> patch) {
        if (id == null) {
            return Optional.empty();
        }
        return table(collection).update(id, patch);
    }

    @Override
    public boolean delete(String collection, String id) {
        if (id == null) {
            return false;
        }
        return table(collection).delete(id);
    }

    private Table table(String collection) {
        return tables.computeIfAbsent(collection, name -> new Table());
    }

    private static final class Table {

        private final Map<String, Map<String, Object>> rows = new LinkedHashMap<>();
        private long sequence;

        synchronized List<Map<String, Object>> list(Map<String, String> filter) {
            return rows.values().stream()
                    .filter(row -> RecordFilter.matches(row, filter))
                    .map(Table::copy)
                    .toList();
        }

        synchronized Optional<Map<String, Object>> get(String id) {
            return Optional.ofNullable(rows.get(id)).map(Table::copy);
        }

        synchronized Map<String, Object> create(Map<String, Object> record) {
            String id = Long.toString(++sequence);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ID, id);
            record.forEach((key, value) -> {
                if (!ID.equals(key)) {
                    row.put(key, value);
                }
            });
            rows.put(id, row);
            return copy(row);
        }

        synchronized Optional<Map<String, Object>> replace(String id, Map<String, Object> record) {
            if (!rows.containsKey(id)) {
                return Optional.empty();
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(ID, id);
            record.forEach((key, value) -> {
                if (!ID.equals(key)) {
                    row.put(key, value);
                }
            });
            rows.put(id, row);
            return Optional.of(copy(row));
        }

        synchronized Optional<Map<String, Object>> update(String id, Map<String, Object> patch) {
            Map<String, Object> row = rows.get(id);
            if (row == null) {
                return Optional.empty();
            }
            patch.forEach((key, value) -> {
                if (!ID.equals(key)) {
                    row.put(key, value);
                }
            });
            return Optional.of(copy(row));
        }

        synchronized boolean delete(String id) {
            return rows.remove(id) != null;
        }

        private static Map<String, Object> copy(Map<String, Object> row) {
            return new LinkedHashMap<>(row);
        }
    }
}
