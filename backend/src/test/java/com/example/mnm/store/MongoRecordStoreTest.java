package com.example.mnm.store;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MongoRecordStoreTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoRecordStore store = new MongoRecordStore(mongoTemplate);

    @Test
    void createTakesTheNextIdFromTheCountersCollection() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(Document.class), eq(MongoRecordStore.COUNTERS)))
                .thenReturn(new Document("_id", "services").append("seq", 7L));

        Map<String, Object> created = store.create("services", Map.of("id", "99", "title", "Leak"));

        assertThat(created).containsEntry("id", "7").containsEntry("title", "Leak");
        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        verify(mongoTemplate).insert(inserted.capture(), eq("services"));
        assertThat(inserted.getValue()).containsEntry("_id", "7").doesNotContainKey("id");
    }

    @Test
    void missingCounterDocumentFailsLoudly() {
        assertThatThrownBy(() -> store.nextId("services")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void listTranslatesIdsAndMatchesNumbersByValue() {
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq("portfolios")))
                .thenReturn(List.of(new Document("_id", "3").append("userId", "7").append("price", 120)));

        List<Map<String, Object>> found = store.list("portfolios", Map.of("price", "120"));

        assertThat(found).singleElement().satisfies(record -> assertThat(record)
                .containsEntry("id", "3")
                .containsEntry("price", 120)
                .doesNotContainKey("_id"));
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Document.class), eq("portfolios"));
        assertThat(query.getValue().getQueryObject().toJson()).contains("\"price\"").contains("120");
    }

    @Test
    void replaceOfMissingRecordDoesNotWrite() {
        when(mongoTemplate.exists(any(Query.class), eq("clients"))).thenReturn(false);

        assertThat(store.replace("clients", "1", Map.of("name", "Ana"))).isEmpty();
        verify(mongoTemplate, never()).save(any(Document.class), eq("clients"));
    }

    @Test
    void updateWithNothingToSetJustReadsTheRecord() {
        when(mongoTemplate.findById("1", Document.class, "clients")).thenReturn(new Document("_id", "1"));

        assertThat(store.update("clients", "1", Map.of("id", "2"))).contains(Map.of("id", "1"));
    }

    @Test
    void decimalsAreStoredAsDecimal128AndReadBackExactly() {
        BigDecimal price = new BigDecimal("12345678901234.567890");
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(Document.class), eq(MongoRecordStore.COUNTERS)))
                .thenReturn(new Document("_id", "portfolios").append("seq", 1L));

        Map<String, Object> created = store.create("portfolios", Map.of("price", price));

        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        verify(mongoTemplate).insert(inserted.capture(), eq("portfolios"));
        assertThat(inserted.getValue().get("price")).isEqualTo(new Decimal128(price));
        assertThat(created.get("price")).isEqualTo(price);
    }
}
