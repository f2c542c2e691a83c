package com.williamcallahan.verified_media_engine.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.williamcallahan.verified_media_engine.testutil.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

class JsonDocumentTest {

    private InMemoryDocumentStore store;
    private JsonDocument<RecordLog<String>> document;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        document = newDocument(store);
    }

    private static JsonDocument<RecordLog<String>> newDocument(DocumentStore store) {
        return new JsonDocument<>(store, TestFixtures.objectMapper(), "log",
            new TypeReference<RecordLog<String>>() {}, RecordLog::new);
    }

    @Test
    void updatePersistsMutations() {
        document.update(log -> {
            log.append("one", 10);
            return null;
        });
        document.update(log -> {
            log.append("two", 10);
            return null;
        });

        assertThat(document.read().getRecords()).containsExactly("one", "two");
        assertThat(store.get("log")).hasValueSatisfying(json -> assertThat(json).contains("\"records\""));
    }

    @Test
    void updateIfChangedOnlyWritesWhenAResultIsReturned() {
        String unchanged = document.updateIfChanged(log -> {
            log.append("discarded", 10);
            return Optional.empty();
        });

        assertThat(unchanged).isNull();
        assertThat(store.get("log")).isEmpty();

        String changed = document.updateIfChanged(log -> {
            log.append("kept", 10);
            return Optional.of("kept");
        });

        assertThat(changed).isEqualTo("kept");
        assertThat(document.read().getRecords()).containsExactly("kept");
    }

    @Test
    void corruptDocumentReadsAsEmpty() {
        store.set("log", "{ this is not json");

        assertThat(document.read().getRecords()).isEmpty();
    }

    @Test
    void resetReplacesTheDocument() {
        document.update(log -> {
            log.append("one", 10);
            return null;
        });

        document.reset();

        assertThat(document.read().getRecords()).isEmpty();
    }

    @Test
    void backendFailuresAreAbsorbed() {
        DocumentStore broken = mock(DocumentStore.class);
        given(broken.get(anyString())).willThrow(new DocumentStoreException("read down"));
        willThrow(new DocumentStoreException("write down")).given(broken).set(anyString(), anyString());
        JsonDocument<RecordLog<String>> fragile = newDocument(broken);

        Integer size = fragile.update(log -> {
            log.append("one", 10);
            return log.getRecords().size();
        });

        assertThat(size).isEqualTo(1);
        assertThat(fragile.read().getRecords()).isEmpty();
    }

    @Test
    void recordLogCapsFromTheRightEnd() {
        RecordLog<Integer> appended = new RecordLog<>();
        RecordLog<Integer> prepended = new RecordLog<>();
        for (int i = 1; i <= 5; i++) {
            appended.append(i, 3);
            prepended.prepend(i, 3);
        }

        assertThat(appended.getRecords()).containsExactly(3, 4, 5);
        assertThat(prepended.getRecords()).containsExactly(5, 4, 3);
        assertThat(appended.tail(2)).containsExactly(4, 5);
        assertThat(appended.tail(10)).containsExactly(3, 4, 5);

        appended.setRecords(null);
        assertThat(appended.getRecords()).isEmpty();
    }
}
