package com.example.mnm.store;

import java.util.Map;
import java.util.Objects;

final class RecordFilter {

    private RecordFilter() {
    }

    static boolean matches(Map<String, Object> record, Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> criterion : filter.entrySet()) {
            Object value = record.get(criterion.getKey());
            if (value == null || !Objects.equals(String.valueOf(value), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
