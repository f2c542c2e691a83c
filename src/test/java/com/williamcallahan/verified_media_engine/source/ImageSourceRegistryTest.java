package com.williamcallahan.verified_media_engine.source;

import com.williamcallahan.verified_media_engine.config.MediaSourceProperties;
import com.williamcallahan.verified_media_engine.testutil.StubImageFetcher;
import com.williamcallahan.verified_media_engine.testutil.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageSourceRegistryTest {

    @Test
    void ordersSourcesByPriorityRankKeepingDeclarationOrderForTies() {
        MediaSourceProperties properties = TestFixtures.sources(
            new MediaSourceProperties.Source("Wikipedia", true, 4, 75, 1000),
            new MediaSourceProperties.Source("LibraryOfCongress", true, 1, 95, 1000),
            new MediaSourceProperties.Source("Smithsonian", true, 2, 93, 1000),
            new MediaSourceProperties.Source("WikimediaCommons", true, 2, 85, 1000));

        ImageSourceRegistry registry = new ImageSourceRegistry(properties, List.of());

        assertThat(registry.sources()).extracting(ImageSource::name)
            .containsExactly("LibraryOfCongress", "Smithsonian", "WikimediaCommons", "Wikipedia");
        assertThat(registry.indexOf("WikimediaCommons")).isEqualTo(2);
        assertThat(registry.indexOf("Unsplash")).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void onlyEnabledSourcesWithFetchersAreFetchable() {
        MediaSourceProperties properties = TestFixtures.sources(
            new MediaSourceProperties.Source("Wikipedia", true, 1, 75, 1000),
            new MediaSourceProperties.Source("Unsplash", false, 2, 60, 1000),
            new MediaSourceProperties.Source("Smithsonian", true, 3, 93, 1000));

        ImageSourceRegistry registry = new ImageSourceRegistry(properties, List.of(
            StubImageFetcher.empty("Wikipedia"), StubImageFetcher.empty("Unsplash")));

        assertThat(registry.isFetchable("Wikipedia")).isTrue();
        assertThat(registry.isFetchable("Unsplash")).isFalse();
        assertThat(registry.isFetchable("Smithsonian")).isFalse();
        assertThat(registry.isFetchable("Unknown")).isFalse();
        assertThat(registry.fetcher("Smithsonian")).isEmpty();
    }

    @Test
    void emptyRegistryFailsStartup() {
        assertThatThrownBy(() -> new ImageSourceRegistry(new MediaSourceProperties(), List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No image sources");
    }

    @Test
    void duplicateNamesFailStartup() {
        MediaSourceProperties properties = TestFixtures.sources(
            new MediaSourceProperties.Source("Wikipedia", true, 1, 75, 1000),
            new MediaSourceProperties.Source("Wikipedia", true, 2, 75, 1000));

        assertThatThrownBy(() -> new ImageSourceRegistry(properties, List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Duplicate image source name: Wikipedia");
    }

    @Test
    void invalidDeclarationsFailStartup() {
        assertThatThrownBy(() -> new ImageSourceRegistry(TestFixtures.sources(
            new MediaSourceProperties.Source(" ", true, 1, 75, 1000)), List.of()))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ImageSourceRegistry(TestFixtures.sources(
            new MediaSourceProperties.Source("Wikipedia", true, 1, 75, 0)), List.of()))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ImageSourceRegistry(TestFixtures.defaultSources(), List.of(
            StubImageFetcher.empty("Wikipedia"), StubImageFetcher.empty("Wikipedia"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("More than one fetcher");
    }
}
