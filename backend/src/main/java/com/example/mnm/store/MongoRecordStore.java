package com.example.mnm.store;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stores each collection as a MongoDB collection of the same name. The record id is kept in
 * {@code _id}; ids come from a per-collection sequence in the {@code counters} collection.
 */
@Repository
@ConditionalOnProperty(prefix = "app.store", name = "type", havingValue = "mongo", matchIfMissing = true)
@SuppressWarnings("null") // Suppress Spring null-safety false positives
public class MongoRecordStore implements RecordStore {

    static final String COUNTERS = "counters";
    private static final String MONGO_ID = "_id";
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    private final MongoTemplate mongoTemplate;

    public MongoRecordStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Map<String, Object>> list(String collection, Map<String, String> filter) {
        Query query = new Query();
        if (filter != null) {
            filter.forEach((field, value) ->
                    query.addCriteria(Criteria.where(toMongoField(field)).in(candidateValues(value))));
        }
        return mongoTemplate.find(query, Document.class, collection).stream()
                .map(this::toRecord)
                .toList();
    }

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, Document.class, collection))
                .map(this::toRecord);
    }

    @Override
    public Map<String, Object> create(String collection, Map<String, Object> record) {
        Document document = toDocument(record);
        document.put(MONGO_ID, nextId(collection));
        mongoTemplate.insert(document, collection);
        return toRecord(document);
    }

    @Override
    public Optional<Map<String, Object>> replace(String collection, String id, Map<String, Object> record) {
        if (id == null || !exists(collection, id)) {
            return Optional.empty();
        }
        Document document = toDocument(record);
        document.put(MONGO_ID, id);
        mongoTemplate.save(document, collection);
        return Optional.of(toRecord(document));
    }

    @Override
    public Optional<Map<String, Object>> update(String collection, String id, Map<String, Object> patch) {
        if (id == null) {
            return Optional.empty();
        }
        Update update = new Update();
        patch.forEach((key, value) -> {
            if (!ID.equals(key) && !MONGO_ID.equals(key)) {
                update.set(key, toBson(value));
            }
        });
        if (update.getUpdateObject().isEmpty()) {
            return get(collection, id);
        }
        Document updated = mongoTemplate.findAndModify(byId(id), update,
                FindAndModifyOptions.options().returnNew(true), Document.class, collection);
        return Optional.ofNullable(updated).map(this::toRecord);
    }

    @Override
    public boolean delete(String collection, String id) {
        if (id == null) {
            return false;
        }
        return mongoTemplate.remove(byId(id), collection).getDeletedCount() > 0;
    }

    String nextId(String collection) {
        Document counter = mongoTemplate.findAndModify(byId(collection), new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true), Document.class, COUNTERS);
        Number seq = counter != null ? (Number) counter.get("seq") : null;
        if (seq == null) {
            throw new IllegalStateException("Could not allocate an id for collection " + collection);
        }
        return Long.toString(seq.longValue());
    }

    private boolean exists(String collection, String id) {
        return mongoTemplate.exists(byId(id), collection);
    }

    private Query byId(String id) {
        return new Query(Criteria.where(MONGO_ID).is(id));
    }

    private String toMongoField(String field) {
        return ID.equals(field) ? MONGO_ID : field;
    }

    private List<Object> candidateValues(String value) {
        List<Object> candidates = new ArrayList<>();
        candidates.add(value);
        if ("true".equals(value) || "false".equals(value)) {
            candidates.add(Boolean.valueOf(value));
        }
        if (INTEGER.matcher(value).matches()) {
            candidates.add(Long.valueOf(value));
        } else if (DECIMAL.matcher(value).matches()) {
            candidates.add(Double.valueOf(value));
            candidates.add(new Decimal128(new BigDecimal(value)));
        }
        return candidates;
    }

    private Document toDocument(Map<String, Object> record) {
        Document document = new Document();
        record.forEach((key, value) -> {
            if (!ID.equals(key) && !MONGO_ID.equals(key)) {
                document.put(key, toBson(value));
            }
        });
        return document;
    }

    private Map<String, Object> toRecord(Document document) {
        Map<String, Object> record = new LinkedHashMap<>();
        Object id = document.get(MONGO_ID);
        record.put(ID, id != null ? id.toString() : null);
        document.forEach((key, value) -> {
            if (!MONGO_ID.equals(key)) {
                record.put(key, fromBson(value));
            }
        });
        return record;
    }

    // decimals are stored as Decimal128 so they keep every digit
    private static Object toBson(Object value) {
        if (value instanceof BigDecimal decimal) {
            return new Decimal128(decimal);
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            map.forEach((key, item) -> nested.put(String.valueOf(key), toBson(item)));
            return nested;
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(MongoRecordStore::toBson).toList();
        }
        return value;
    }

    private static Object fromBson(Object value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, item) -> nested.put(String.valueOf(key), fromBson(item)));
            return nested;
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(MongoRecordStore::fromBson).toList();
        }
        return value;
    }
}
