package com.williamcallahan.verified_media_engine.service.image;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.image.CandidateMetadata;
import com.williamcallahan.verified_media_engine.model.image.FetchedImage;
import com.williamcallahan.verified_media_engine.model.image.SourcedImage;
import com.williamcallahan.verified_media_engine.monitoring.MetricsService;
import com.williamcallahan.verified_media_engine.service.cache.SourceAttemptCache;
import com.williamcallahan.verified_media_engine.source.ImageSource;
import com.williamcallahan.verified_media_engine.source.ImageSourceFetcher;
import com.williamcallahan.verified_media_engine.source.ImageSourceRegistry;
import com.williamcallahan.verified_media_engine.util.AsyncUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Concurrent fan-out over image sources
 *
 * Features:
 * - One fetch per source, each bounded by that source's timeout; a timed-out fetch is cancelled
 * - A failing or slow source yields no candidate and never affects the others
 * - The join is bounded by the fan-out deadline; late results are dropped
 * - Results come back in registry order regardless of arrival order
 * - Result handling runs on the fetch executor, never on the HTTP client's event loop
 * - Clean "nothing found" answers are remembered so the pair is skipped next time
 */
@Service
public class CandidateFetchingService {

    private static final Logger logger = LoggerFactory.getLogger(CandidateFetchingService.class);

    private final ImageSourceRegistry sourceRegistry;
    private final SourceAttemptCache attemptCache;
    private final MetricsService metricsService;
    private final Executor sourceFetchExecutor;
    private final long fanOutDeadlineMs;

    public CandidateFetchingService(ImageSourceRegistry sourceRegistry,
                                    SourceAttemptCache attemptCache,
                                    MetricsService metricsService,
                                    @Qualifier("sourceFetchExecutor") Executor sourceFetchExecutor,
                                    AppConfigurationProperties properties) {
        this.sourceRegistry = sourceRegistry;
        this.attemptCache = attemptCache;
        this.metricsService = metricsService;
        this.sourceFetchExecutor = sourceFetchExecutor;
        this.fanOutDeadlineMs = properties.getSelection().getFanOutDeadlineMs();
    }

    /**
     * Fetches from every given source concurrently
     *
     * @param sources sources to query
     * @param searchTerm term passed to every fetcher
     * @param year event year passed to every fetcher
     * @return images that arrived in time, in registry order
     */
    public CompletableFuture<List<SourcedImage>> fetchAll(List<ImageSource> sources, String searchTerm, Integer year) {
        List<ImageSource> ordered = new ArrayList<>(sources);
        ordered.sort(Comparator.comparingInt(source -> sourceRegistry.indexOf(source.name())));

        List<CompletableFuture<SourcedImage>> fetches = new ArrayList<>(ordered.size());
        for (ImageSource source : ordered) {
            fetches.add(fetchOne(source, searchTerm, year)
                .thenApply(image -> image.map(found -> new SourcedImage(source.name(), found)).orElse(null)));
        }
        logger.info("Fetching '{}' from {} sources: {}", searchTerm, ordered.size(),
            ordered.stream().map(ImageSource::name).toList());
        return AsyncUtils.settleWithin(fetches, fanOutDeadlineMs, "fetch '" + searchTerm + "'")
            .thenApply(results -> {
                logger.info("Fetch for '{}' returned {} of {} candidates", searchTerm, results.size(), ordered.size());
                return results;
            });
    }

    /**
     * Fetches from a single named source, used to re-fetch a cached selection
     *
     * @return the image, or empty when the source is unknown, disabled, failed or found nothing
     */
    public CompletableFuture<Optional<FetchedImage>> fetchFrom(String sourceName, String searchTerm, Integer year) {
        Optional<ImageSource> source = sourceRegistry.find(sourceName);
        if (source.isEmpty() || !sourceRegistry.isFetchable(sourceName)) {
            logger.warn("Source {} is not available for re-fetch", sourceName);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return fetchOne(source.get(), searchTerm, year);
    }

    /**
     * Never completes exceptionally: failures and timeouts become an empty result
     */
    private CompletableFuture<Optional<FetchedImage>> fetchOne(ImageSource source, String searchTerm, Integer year) {
        Optional<ImageSourceFetcher> fetcher = sourceRegistry.fetcher(source.name());
        if (fetcher.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        long started = System.currentTimeMillis();
        InFlightFetch inFlight = new InFlightFetch();
        return CompletableFuture
            .supplyAsync(() -> inFlight.track(fetcher.get().fetch(searchTerm, year)), sourceFetchExecutor)
            .thenCompose(future -> future == null
                ? CompletableFuture.completedFuture(Optional.<FetchedImage>empty())
                : future)
            .orTimeout(source.timeoutMs(), TimeUnit.MILLISECONDS)
            .handleAsync((result, ex) -> {
                long elapsed = System.currentTimeMillis() - started;
                if (ex != null) {
                    Throwable cause = AsyncUtils.unwrap(ex);
                    boolean timedOut = cause instanceof TimeoutException;
                    metricsService.incrementSourceFailure(source.name(), timedOut);
                    if (timedOut) {
                        inFlight.abandon();
                        logger.warn("Source {} timed out after {}ms for '{}'", source.name(), source.timeoutMs(), searchTerm);
                    } else {
                        logger.warn("Source {} failed for '{}' after {}ms: {}", source.name(), searchTerm, elapsed, cause.getMessage());
                    }
                    return Optional.<FetchedImage>empty();
                }
                Optional<FetchedImage> image = result == null ? Optional.<FetchedImage>empty() : result;
                Optional<FetchedImage> usable = image
                    .filter(found -> found.byteSize() > 0)
                    .map(found -> new FetchedImage(found.bytes(), found.metadata() == null
                        ? CandidateMetadata.forSearchTerm(searchTerm)
                        : found.metadata().withSearchTermFallback(searchTerm)));
                if (usable.isEmpty()) {
                    attemptCache.recordMiss(source.name(), searchTerm);
                    logger.debug("Source {} had no image for '{}' ({}ms)", source.name(), searchTerm, elapsed);
                } else {
                    logger.debug("Source {} returned {} bytes for '{}' in {}ms",
                        source.name(), usable.get().byteSize(), searchTerm, elapsed);
                }
                return usable;
            }, sourceFetchExecutor);
    }

    /**
     * Future handed back by a fetcher; cancelled when its source times out so the request is dropped
     */
    private static final class InFlightFetch {

        private CompletableFuture<?> fetch;
        private boolean abandoned;

        synchronized <T> CompletableFuture<T> track(CompletableFuture<T> started) {
            fetch = started;
            if (abandoned && started != null) {
                started.cancel(true);
            }
            return started;
        }

        synchronized void abandon() {
            abandoned = true;
            if (fetch != null) {
                fetch.cancel(true);
            }
        }
    }
}
