package com.williamcallahan.verified_media_engine.source;

import com.williamcallahan.verified_media_engine.config.MediaSourceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered registry of configured sources and the fetchers that serve them
 * - Registry order is declaration order stable-sorted by priority rank
 * - An empty registry, a blank name or a duplicate name fails startup
 * - Sources without a fetcher stay ranked but are never fetched
 */
@Component
public class ImageSourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ImageSourceRegistry.class);

    private final List<ImageSource> sources;
    private final Map<String, ImageSourceFetcher> fetchers;

    public ImageSourceRegistry(MediaSourceProperties properties, List<ImageSourceFetcher> fetchers) {
        this.sources = buildSources(properties.getSources());
        this.fetchers = indexFetchers(fetchers);

        for (ImageSource source : sources) {
            if (source.enabled() && !this.fetchers.containsKey(source.name())) {
                logger.warn("Source {} is enabled but has no registered fetcher; it will be skipped", source.name());
            }
        }
        logger.info("Image source registry initialized with {} sources ({} with fetchers): {}",
            sources.size(), this.fetchers.size(), sources.stream().map(ImageSource::name).toList());
    }

    private static List<ImageSource> buildSources(List<MediaSourceProperties.Source> declared) {
        if (declared == null || declared.isEmpty()) {
            throw new IllegalStateException("No image sources configured under app.media.sources");
        }
        Set<String> seen = new HashSet<>();
        List<ImageSource> built = new ArrayList<>();
        for (MediaSourceProperties.Source source : declared) {
            String name = source.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Image source declared without a name");
            }
            if (!seen.add(name)) {
                throw new IllegalStateException("Duplicate image source name: " + name);
            }
            if (source.getTimeoutMs() <= 0) {
                throw new IllegalStateException("Image source " + name + " must have a positive timeoutMs");
            }
            built.add(new ImageSource(name, source.isEnabled(), source.getPriorityRank(),
                source.getReliabilityScore(), source.getTimeoutMs()));
        }
        built.sort(Comparator.comparingInt(ImageSource::priorityRank));
        return Collections.unmodifiableList(built);
    }

    private static Map<String, ImageSourceFetcher> indexFetchers(List<ImageSourceFetcher> fetchers) {
        Map<String, ImageSourceFetcher> indexed = new LinkedHashMap<>();
        if (fetchers == null) {
            return indexed;
        }
        for (ImageSourceFetcher fetcher : fetchers) {
            ImageSourceFetcher previous = indexed.putIfAbsent(fetcher.sourceName(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("More than one fetcher registered for source " + fetcher.sourceName());
            }
        }
        return indexed;
    }

    /**
     * All configured sources in registry order
     */
    public List<ImageSource> sources() {
        return sources;
    }

    public Optional<ImageSource> find(String name) {
        return sources.stream().filter(source -> source.name().equals(name)).findFirst();
    }

    /**
     * Position in registry order, used as the ranking tie-breaker; unknown names sort last
     */
    public int indexOf(String name) {
        for (int i = 0; i < sources.size(); i++) {
            if (sources.get(i).name().equals(name)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    public Optional<ImageSourceFetcher> fetcher(String name) {
        return Optional.ofNullable(fetchers.get(name));
    }

    /**
     * Whether a source can currently be fetched from
     */
    public boolean isFetchable(String name) {
        return find(name).map(ImageSource::enabled).orElse(false) && fetchers.containsKey(name);
    }
}
