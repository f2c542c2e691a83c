package com.williamcallahan.verified_media_engine.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for the selection pipeline
 * - Counters for outcomes, cache hits, source failures and oracle errors
 * - Timer for end-to-end selection duration
 * - Gauge for selections in flight
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter selectionsAccepted;
    private final Counter selectionsRejected;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter qualityRejections;
    private final Counter reuseRejections;
    private final Counter oracleErrors;
    private final Counter engagementUpdates;

    private final AtomicInteger activeSelections = new AtomicInteger(0);

    private final Timer selectionTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.selectionsAccepted = Counter.builder("media.selections")
            .description("Completed selections by outcome")
            .tag("outcome", "accepted")
            .register(meterRegistry);

        this.selectionsRejected = Counter.builder("media.selections")
            .description("Completed selections by outcome")
            .tag("outcome", "rejected")
            .register(meterRegistry);

        this.cacheHits = Counter.builder("media.cache.hits")
            .description("Selections served from the result cache")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("media.cache.misses")
            .description("Selections that could not be served from the result cache")
            .register(meterRegistry);

        this.qualityRejections = Counter.builder("media.candidates.rejected")
            .description("Candidates dropped before scoring")
            .tag("reason", "quality")
            .register(meterRegistry);

        this.reuseRejections = Counter.builder("media.candidates.rejected")
            .description("Candidates dropped before scoring")
            .tag("reason", "recently_used")
            .register(meterRegistry);

        this.oracleErrors = Counter.builder("media.oracle.errors")
            .description("Oracle calls that ended in an ERROR verdict")
            .register(meterRegistry);

        this.engagementUpdates = Counter.builder("media.engagement.updates")
            .description("Engagement metrics applied to selection records")
            .register(meterRegistry);

        Gauge.builder("media.selections.active", activeSelections, AtomicInteger::get)
            .description("Selections currently in progress")
            .register(meterRegistry);

        this.selectionTimer = Timer.builder("media.selection.duration")
            .description("End-to-end selection duration")
            .register(meterRegistry);
    }

    public void recordSelection(boolean accepted, long durationMs) {
        if (accepted) {
            selectionsAccepted.increment();
        } else {
            selectionsRejected.increment();
        }
        selectionTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementQualityRejection() {
        qualityRejections.increment();
    }

    public void incrementReuseRejection() {
        reuseRejections.increment();
    }

    public void incrementOracleError() {
        oracleErrors.increment();
    }

    public void incrementEngagementUpdate() {
        engagementUpdates.increment();
    }

    /**
     * Counts a failed fetch, tagged by source and whether it timed out
     */
    public void incrementSourceFailure(String sourceName, boolean timedOut) {
        Counter.builder("media.source.fetch.failures")
            .description("Source fetches that produced no candidate because of an error")
            .tag("source", sourceName)
            .tag("type", timedOut ? "timeout" : "error")
            .register(meterRegistry)
            .increment();
    }

    public void selectionStarted() {
        activeSelections.incrementAndGet();
    }

    public void selectionFinished() {
        activeSelections.decrementAndGet();
    }
}
