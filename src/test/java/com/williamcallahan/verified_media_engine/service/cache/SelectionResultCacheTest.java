package com.williamcallahan.verified_media_engine.service.cache;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.cache.CacheEntry;
import com.williamcallahan.verified_media_engine.model.cache.CacheStats;
import com.williamcallahan.verified_media_engine.model.cache.CachedSelection;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.storage.InMemoryDocumentStore;
import com.williamcallahan.verified_media_engine.testutil.MutableClock;
import com.williamcallahan.verified_media_engine.testutil.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionResultCacheTest {

    private static final HistoricalEvent APOLLO = new HistoricalEvent(1969, "Apollo 11 moon landing with Neil Armstrong");

    private InMemoryDocumentStore store;
    private MutableClock clock;
    private AppConfigurationProperties properties;
    private SelectionResultCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        clock = new MutableClock(TestFixtures.START);
        properties = new AppConfigurationProperties();
        properties.getCache().setMaxEntries(3);
        cache = new SelectionResultCache(store, TestFixtures.objectMapper(), properties, clock);
    }

    private static CachedSelection selection(String source, int confidence) {
        return new CachedSelection(source, confidence, Verdict.APPROVED,
            new StyleProfile("photograph", "vintage", "black-and-white"), "Apollo 11 moon landing", "https://example.org/a.jpg");
    }

    private static HistoricalEvent event(int n) {
        return new HistoricalEvent(1900 + n, "Event number " + n + " happened somewhere important");
    }

    @Test
    void storeThenLookupReturnsTheSelection() {
        cache.store(APOLLO, selection("Wikipedia", 88));

        CacheEntry entry = cache.lookup(APOLLO).orElseThrow();

        assertThat(entry.getSource()).isEqualTo("Wikipedia");
        assertThat(entry.getConfidence()).isEqualTo(88);
        assertThat(entry.getVerdict()).isEqualTo(Verdict.APPROVED);
        assertThat(entry.getStyleInfo().type()).isEqualTo("photograph");
        assertThat(entry.getEventYear()).isEqualTo(1969);
        assertThat(entry.getSearchTerm()).isEqualTo("Apollo 11 moon landing");
        assertThat(entry.getKey()).isEqualTo("1969_apollo_moon_landing_with_neil_armstrong");
    }

    @Test
    @DisplayName("lookup touches the entry, peek does not")
    void lookupIncrementsUseCount() {
        cache.store(APOLLO, selection("Wikipedia", 88));
        clock.advance(Duration.ofHours(1));

        assertThat(cache.lookup(APOLLO).orElseThrow().getUseCount()).isEqualTo(2);
        assertThat(cache.lookup(APOLLO).orElseThrow().getUseCount()).isEqualTo(3);

        CacheEntry peeked = cache.peek(APOLLO).orElseThrow();
        assertThat(peeked.getUseCount()).isEqualTo(3);
        assertThat(peeked.getLastUsed()).isEqualTo(TestFixtures.START.plus(Duration.ofHours(1)));
        assertThat(cache.peek(APOLLO).orElseThrow().getUseCount()).isEqualTo(3);
    }

    @Test
    void missDoesNotWriteTheDocument() {
        assertThat(cache.lookup(APOLLO)).isEmpty();
        assertThat(store.get(SelectionResultCache.DOCUMENT_KEY)).isEmpty();
    }

    @Test
    void storingAgainReplacesTheEntryAndResetsUseCount() {
        cache.store(APOLLO, selection("Wikipedia", 88));
        cache.lookup(APOLLO);

        cache.store(APOLLO, selection("LibraryOfCongress", 92));

        CacheEntry entry = cache.peek(APOLLO).orElseThrow();
        assertThat(entry.getSource()).isEqualTo("LibraryOfCongress");
        assertThat(entry.getUseCount()).isEqualTo(1);
        assertThat(cache.stats().totalEntries()).isEqualTo(1);
    }

    @Test
    @DisplayName("store evicts least recently used entries once the map outgrows its headroom")
    void storeEvictsLeastRecentlyUsed() {
        for (int i = 1; i <= 4; i++) {
            cache.store(event(i), selection("Wikipedia", 80));
            clock.advance(Duration.ofMinutes(1));
        }
        cache.lookup(event(1));
        clock.advance(Duration.ofMinutes(1));

        cache.store(event(5), selection("Wikipedia", 80));

        assertThat(cache.peek(event(2))).isEmpty();
        assertThat(cache.peek(event(1))).isPresent();
        assertThat(cache.peek(event(3))).isPresent();
        assertThat(cache.peek(event(4))).isPresent();
        assertThat(cache.peek(event(5))).isPresent();
    }

    @Test
    void evictRemovesEntriesAtOrBeyondMaxAge() {
        cache.store(event(1), selection("Wikipedia", 80));
        clock.advance(Duration.ofDays(10));
        cache.store(event(2), selection("Wikipedia", 80));
        clock.advance(Duration.ofDays(80));

        assertThat(cache.evict()).isEqualTo(1);
        assertThat(cache.peek(event(1))).isEmpty();
        assertThat(cache.peek(event(2))).isPresent();
    }

    @Test
    void evictTrimsToCapacityByRecency() {
        properties.getCache().setEvictionHeadroom(10.0);
        for (int i = 1; i <= 6; i++) {
            cache.store(event(i), selection("Wikipedia", 80));
            clock.advance(Duration.ofMinutes(1));
        }

        assertThat(cache.evict()).isEqualTo(3);
        assertThat(cache.stats().totalEntries()).isEqualTo(3);
        assertThat(cache.peek(event(6))).isPresent();
        assertThat(cache.peek(event(1))).isEmpty();
    }

    @Test
    void corruptDocumentBehavesAsEmptyCache() {
        store.set(SelectionResultCache.DOCUMENT_KEY, "[not a map");

        assertThat(cache.lookup(APOLLO)).isEmpty();
        assertThat(cache.stats()).isEqualTo(CacheStats.empty());

        cache.store(APOLLO, selection("Wikipedia", 88));
        assertThat(cache.lookup(APOLLO)).isPresent();
    }

    @Test
    void statsSummarizeEntries() {
        cache.store(event(1), selection("Wikipedia", 80));
        clock.advance(Duration.ofDays(1));
        cache.store(event(2), selection("LibraryOfCongress", 90));
        cache.lookup(event(2));

        CacheStats stats = cache.stats();

        assertThat(stats.totalEntries()).isEqualTo(2);
        assertThat(stats.totalUses()).isEqualTo(3);
        assertThat(stats.averageConfidence()).isEqualTo(85.0);
        assertThat(stats.oldestEntry()).isEqualTo(TestFixtures.START);
    }

    @Test
    void clearEmptiesTheCache() {
        cache.store(APOLLO, selection("Wikipedia", 88));

        cache.clear();

        assertThat(cache.peek(APOLLO)).isEmpty();
        assertThat(cache.stats().totalEntries()).isZero();
    }
}
