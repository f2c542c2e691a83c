package com.williamcallahan.verified_media_engine.service.selection;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.cache.CacheEntry;
import com.williamcallahan.verified_media_engine.model.cache.CachedSelection;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementMetrics;
import com.williamcallahan.verified_media_engine.model.image.FetchedImage;
import com.williamcallahan.verified_media_engine.model.image.ImageCandidate;
import com.williamcallahan.verified_media_engine.model.image.QualityCheckResult;
import com.williamcallahan.verified_media_engine.model.image.SourcedImage;
import com.williamcallahan.verified_media_engine.model.selection.ScoredCandidate;
import com.williamcallahan.verified_media_engine.model.selection.SelectionOutcome;
import com.williamcallahan.verified_media_engine.model.selection.SelectionState;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;
import com.williamcallahan.verified_media_engine.monitoring.MetricsService;
import com.williamcallahan.verified_media_engine.service.ai.ImageVerificationService;
import com.williamcallahan.verified_media_engine.service.cache.SelectionResultCache;
import com.williamcallahan.verified_media_engine.service.cache.SourceAttemptCache;
import com.williamcallahan.verified_media_engine.service.engagement.EngagementStore;
import com.williamcallahan.verified_media_engine.service.image.CandidateFetchingService;
import com.williamcallahan.verified_media_engine.service.image.ImageQualityFilter;
import com.williamcallahan.verified_media_engine.service.image.ImageReuseGuard;
import com.williamcallahan.verified_media_engine.service.ranking.SourceOptimizer;
import com.williamcallahan.verified_media_engine.service.style.StylePreferenceService;
import com.williamcallahan.verified_media_engine.source.ImageSource;
import com.williamcallahan.verified_media_engine.source.ImageSourceRegistry;
import com.williamcallahan.verified_media_engine.util.AsyncUtils;
import com.williamcallahan.verified_media_engine.util.CacheKeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Picks, verifies and caches the image that illustrates a historical event
 *
 * Features:
 * - Serves repeat events from the result cache after a fresh re-fetch and quality check
 * - Fetches the top ranked sources concurrently and drops unusable or recently used images
 * - Verifies and style-scores every surviving candidate concurrently
 * - Accepts the best candidate only when the oracle approved it with enough confidence
 * - Never throws: every failure ends in a "no image" outcome
 */
@Service
public class MediaSelectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(MediaSelectionEngine.class);

    private final SelectionResultCache resultCache;
    private final SourceOptimizer sourceOptimizer;
    private final ImageSourceRegistry sourceRegistry;
    private final SourceAttemptCache attemptCache;
    private final CandidateFetchingService fetchingService;
    private final ImageQualityFilter qualityFilter;
    private final ImageReuseGuard reuseGuard;
    private final ImageVerificationService verificationService;
    private final StylePreferenceService stylePreferenceService;
    private final EngagementStore engagementStore;
    private final MetricsService metricsService;
    private final AppConfigurationProperties.Selection settings;

    public MediaSelectionEngine(SelectionResultCache resultCache,
                                SourceOptimizer sourceOptimizer,
                                ImageSourceRegistry sourceRegistry,
                                SourceAttemptCache attemptCache,
                                CandidateFetchingService fetchingService,
                                ImageQualityFilter qualityFilter,
                                ImageReuseGuard reuseGuard,
                                ImageVerificationService verificationService,
                                StylePreferenceService stylePreferenceService,
                                EngagementStore engagementStore,
                                MetricsService metricsService,
                                AppConfigurationProperties properties) {
        this.resultCache = resultCache;
        this.sourceOptimizer = sourceOptimizer;
        this.sourceRegistry = sourceRegistry;
        this.attemptCache = attemptCache;
        this.fetchingService = fetchingService;
        this.qualityFilter = qualityFilter;
        this.reuseGuard = reuseGuard;
        this.verificationService = verificationService;
        this.stylePreferenceService = stylePreferenceService;
        this.engagementStore = engagementStore;
        this.metricsService = metricsService;
        this.settings = properties.getSelection();
    }

    /**
     * Blocking selection using the default recent-source window
     *
     * @param event event to illustrate
     * @param generatedText post copy the image will accompany
     * @return accepted image or "no image", never null
     */
    public SelectionOutcome selectImage(HistoricalEvent event, String generatedText) {
        return selectImage(event, generatedText, null);
    }

    /**
     * Blocking selection
     *
     * @param recentSources recently used sources for the exploration penalty, null for the default window
     */
    public SelectionOutcome selectImage(HistoricalEvent event, String generatedText, Collection<String> recentSources) {
        try {
            return selectImageAsync(event, generatedText, recentSources)
                .get(settings.getBlockingTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Selection for {} interrupted", event.logLabel());
            return SelectionOutcome.rejected("selection interrupted");
        } catch (TimeoutException e) {
            logger.error("Selection for {} did not finish within {}ms", event.logLabel(), settings.getBlockingTimeoutMs());
            return SelectionOutcome.rejected("selection timed out");
        } catch (ExecutionException e) {
            logger.error("Selection for {} failed unexpectedly", event.logLabel(), e.getCause());
            return SelectionOutcome.rejected("selection failed: " + e.getCause().getMessage());
        }
    }

    public CompletableFuture<SelectionOutcome> selectImageAsync(HistoricalEvent event, String generatedText) {
        return selectImageAsync(event, generatedText, null);
    }

    /**
     * Runs the selection state machine
     *
     * @param event event to illustrate
     * @param generatedText post copy the image will accompany
     * @param recentSources recently used sources for the exploration penalty, null for the default window
     * @return future that always completes normally
     */
    public CompletableFuture<SelectionOutcome> selectImageAsync(HistoricalEvent event, String generatedText,
                                                                Collection<String> recentSources) {
        long started = System.currentTimeMillis();
        metricsService.selectionStarted();
        String logKey;
        CompletableFuture<SelectionOutcome> pipeline;
        try {
            String key = CacheKeyUtils.deriveKey(event);
            logKey = key;
            pipeline = checkCache(key, event)
                .thenCompose(cached -> cached.isPresent()
                    ? CompletableFuture.completedFuture(cached.get())
                    : fetchAndScore(key, event, generatedText, recentSources));
        } catch (RuntimeException e) {
            logKey = String.valueOf(event == null ? null : event.year());
            pipeline = CompletableFuture.failedFuture(e);
        }
        final String selectionKey = logKey;
        return pipeline.handle((outcome, ex) -> {
            SelectionOutcome result = outcome;
            if (ex != null) {
                Throwable cause = AsyncUtils.unwrap(ex);
                logger.error("[{}] Selection failed unexpectedly", selectionKey, cause);
                result = SelectionOutcome.rejected("selection failed: " + cause.getMessage());
            }
            long elapsed = System.currentTimeMillis() - started;
            metricsService.selectionFinished();
            metricsService.recordSelection(result.isAccepted(), elapsed);
            logger.info("[{}] Selection finished in {}ms: {}", selectionKey, elapsed, result);
            return result;
        });
    }

    /**
     * Applies engagement metrics reported for a past selection
     *
     * @return true when applied, false for unknown or already measured selections
     */
    public boolean recordEngagement(String selectionId, EngagementMetrics metrics) {
        boolean applied = engagementStore.updateEngagement(selectionId, metrics);
        if (applied) {
            metricsService.incrementEngagementUpdate();
        }
        return applied;
    }

    private CompletableFuture<Optional<SelectionOutcome>> checkCache(String key, HistoricalEvent event) {
        transition(key, SelectionState.CACHE_CHECK);
        Optional<CacheEntry> hit = resultCache.lookup(event);
        if (hit.isEmpty()) {
            metricsService.incrementCacheMiss();
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CacheEntry entry = hit.get();
        String searchTerm = entry.getSearchTerm() != null && !entry.getSearchTerm().isBlank()
            ? entry.getSearchTerm()
            : CacheKeyUtils.searchTerm(event);
        return fetchingService.fetchFrom(entry.getSource(), searchTerm, event.year())
            .thenApply(refetched -> serveFromCache(key, event, entry, refetched));
    }

    private Optional<SelectionOutcome> serveFromCache(String key, HistoricalEvent event, CacheEntry entry,
                                                      Optional<FetchedImage> refetched) {
        if (refetched.isEmpty()) {
            logger.info("[{}] Cached source {} returned nothing on re-fetch, running full selection", key, entry.getSource());
            metricsService.incrementCacheMiss();
            return Optional.empty();
        }
        byte[] bytes = refetched.get().bytes();
        QualityCheckResult quality = qualityFilter.check(bytes);
        if (!quality.passed()) {
            logger.info("[{}] Re-fetched image from {} failed quality check ({}), running full selection",
                key, entry.getSource(), quality.reason());
            metricsService.incrementCacheMiss();
            return Optional.empty();
        }
        String selectionId = newSelectionId();
        StyleProfile style = entry.getStyleInfo() == null ? StyleProfile.unknown() : entry.getStyleInfo();
        runSideEffect(key, "engagement record", () ->
            engagementStore.recordSelection(selectionId, entry.getSource(), entry.getConfidence(), entry.getVerdict()));
        runSideEffect(key, "style tracking", () -> stylePreferenceService.track(selectionId, style));
        metricsService.incrementCacheHit();
        transition(key, SelectionState.ACCEPTED);
        return Optional.of(SelectionOutcome.acceptedFromCache(selectionId, bytes, entry.getSource(),
            entry.getConfidence(), entry.getVerdict(), style));
    }

    private CompletableFuture<SelectionOutcome> fetchAndScore(String key, HistoricalEvent event, String generatedText,
                                                              Collection<String> recentSources) {
        String searchTerm = CacheKeyUtils.searchTerm(event);
        List<String> order = recentSources == null ? sourceOptimizer.order() : sourceOptimizer.order(recentSources);
        List<ImageSource> selected = new ArrayList<>();
        for (String name : order) {
            if (selected.size() >= settings.getTopSources()) {
                break;
            }
            if (!sourceRegistry.isFetchable(name)) {
                continue;
            }
            if (attemptCache.isKnownMiss(name, searchTerm)) {
                logger.debug("[{}] Skipping {}: recently had nothing for '{}'", key, name, searchTerm);
                continue;
            }
            sourceRegistry.find(name).ifPresent(selected::add);
        }
        if (selected.isEmpty()) {
            transition(key, SelectionState.REJECTED);
            return CompletableFuture.completedFuture(SelectionOutcome.rejected("no fetchable sources available"));
        }

        transition(key, SelectionState.FETCHING);
        return fetchingService.fetchAll(selected, searchTerm, event.year())
            .thenCompose(images -> {
                transition(key, SelectionState.FILTERING);
                List<ImageCandidate> candidates = filter(key, images);
                if (candidates.isEmpty()) {
                    transition(key, SelectionState.REJECTED);
                    return CompletableFuture.completedFuture(
                        SelectionOutcome.rejected("no candidate passed quality filtering"));
                }
                transition(key, SelectionState.SCORING);
                return score(event, generatedText, candidates)
                    .thenApply(scored -> decide(key, event, scored));
            });
    }

    private List<ImageCandidate> filter(String key, List<SourcedImage> images) {
        List<ImageCandidate> candidates = new ArrayList<>();
        for (SourcedImage sourced : images) {
            FetchedImage image = sourced.image();
            QualityCheckResult quality = qualityFilter.check(image.bytes());
            if (!quality.passed()) {
                metricsService.incrementQualityRejection();
                logger.info("[{}] Candidate from {} rejected: {}", key, sourced.sourceName(), quality.reason());
                continue;
            }
            String url = image.metadata() == null ? null : image.metadata().url();
            if (reuseGuard.wasRecentlyUsed(image.bytes(), url)) {
                metricsService.incrementReuseRejection();
                logger.info("[{}] Candidate from {} rejected: used within the cooldown", key, sourced.sourceName());
                continue;
            }
            candidates.add(new ImageCandidate(sourced.sourceName(), image.bytes(), image.metadata(), quality.metadata()));
        }
        return candidates;
    }

    private CompletableFuture<List<ScoredCandidate>> score(HistoricalEvent event, String generatedText,
                                                            List<ImageCandidate> candidates) {
        List<CompletableFuture<ScoredCandidate>> scoring = new ArrayList<>(candidates.size());
        for (ImageCandidate candidate : candidates) {
            CompletableFuture<VerificationResult> verification = verificationService.verify(candidate, event, generatedText);
            CompletableFuture<StyleProfile> style = verificationService.analyzeStyle(candidate);
            scoring.add(verification.thenCombine(style, (result, profile) -> new ScoredCandidate(candidate, result,
                profile, stylePreferenceService.preferenceScore(profile), sourceRegistry.indexOf(candidate.sourceName()))));
        }
        return AsyncUtils.settleWithin(scoring, settings.getScoringDeadlineMs(), "scoring " + event.logLabel());
    }

    private SelectionOutcome decide(String key, HistoricalEvent event, List<ScoredCandidate> scored) {
        transition(key, SelectionState.DECIDING);
        if (scored.isEmpty()) {
            transition(key, SelectionState.REJECTED);
            return SelectionOutcome.rejected("no candidate finished scoring");
        }
        List<ScoredCandidate> ranked = new ArrayList<>(scored);
        ranked.sort(ScoredCandidate.RANKING);
        for (ScoredCandidate candidate : ranked) {
            logger.info("[{}] {}: {} {}% style {} combined {}", key, candidate.sourceName(),
                candidate.verification().verdict(), candidate.verification().confidence(),
                String.format("%.1f", candidate.styleScore()), String.format("%.1f", candidate.combinedScore()));
        }
        ScoredCandidate best = ranked.get(0);
        if (!best.verification().isAcceptable()) {
            transition(key, SelectionState.REJECTED);
            return SelectionOutcome.rejected(String.format("best candidate from %s was %s at %d%% (needs APPROVED at %d%%)",
                best.sourceName(), best.verification().verdict(), best.verification().confidence(),
                VerificationResult.ACCEPT_CONFIDENCE_THRESHOLD), best);
        }
        return accept(key, event, best);
    }

    private SelectionOutcome accept(String key, HistoricalEvent event, ScoredCandidate winner) {
        String selectionId = newSelectionId();
        ImageCandidate candidate = winner.candidate();
        String searchTerm = candidate.metadata() == null ? CacheKeyUtils.searchTerm(event) : candidate.metadata().searchTerm();
        String url = candidate.metadata() == null ? null : candidate.metadata().url();
        runSideEffect(key, "result cache write", () -> resultCache.store(event, new CachedSelection(
            winner.sourceName(), winner.verification().confidence(), winner.verification().verdict(),
            winner.style(), searchTerm, url)));
        runSideEffect(key, "engagement record", () -> engagementStore.recordSelection(selectionId,
            winner.sourceName(), winner.verification().confidence(), winner.verification().verdict()));
        runSideEffect(key, "style tracking", () -> stylePreferenceService.track(selectionId, winner.style()));
        runSideEffect(key, "reuse marking", () -> reuseGuard.markUsed(candidate.imageBytes(), url,
            winner.sourceName(), event.description()));
        transition(key, SelectionState.ACCEPTED);
        return SelectionOutcome.accepted(selectionId, winner);
    }

    private void runSideEffect(String key, String description, Runnable sideEffect) {
        try {
            sideEffect.run();
        } catch (RuntimeException e) {
            logger.error("[{}] {} failed, continuing with the selection", key, description, e);
        }
    }

    private static void transition(String key, SelectionState state) {
        logger.info("[{}] -> {}", key, state);
    }

    private static String newSelectionId() {
        return UUID.randomUUID().toString();
    }
}
