package com.williamcallahan.verified_media_engine;

import com.williamcallahan.verified_media_engine.service.selection.MediaSelectionEngine;
import com.williamcallahan.verified_media_engine.source.ImageSourceRegistry;
import com.williamcallahan.verified_media_engine.storage.DocumentStore;
import com.williamcallahan.verified_media_engine.storage.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context load smoke test on the in-memory store with remote fetchers switched off
 */
@SpringBootTest
@ActiveProfiles("test")
class VerifiedMediaEngineApplicationTests {

    @Autowired
    private MediaSelectionEngine selectionEngine;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private ImageSourceRegistry sourceRegistry;

    @Test
    void contextLoads() {
        assertThat(selectionEngine).isNotNull();
        assertThat(documentStore).isInstanceOf(InMemoryDocumentStore.class);
        assertThat(sourceRegistry.sources()).extracting("name")
            .contains("LibraryOfCongress", "Wikipedia");
        assertThat(sourceRegistry.isFetchable("Wikipedia")).isFalse();
    }
}
