package com.williamcallahan.verified_media_engine.controller;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.controller.dto.EngagementRequest;
import com.williamcallahan.verified_media_engine.controller.dto.SelectionRequest;
import com.williamcallahan.verified_media_engine.controller.dto.SelectionResponse;
import com.williamcallahan.verified_media_engine.controller.dto.SourceRankingResponse;
import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.cache.CacheStats;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementStats;
import com.williamcallahan.verified_media_engine.service.cache.SelectionResultCache;
import com.williamcallahan.verified_media_engine.service.engagement.EngagementStore;
import com.williamcallahan.verified_media_engine.service.ranking.SourceOptimizer;
import com.williamcallahan.verified_media_engine.service.selection.MediaSelectionEngine;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP surface of the media selection engine
 *
 * Features:
 * - Runs selections asynchronously and returns the image inline as base64
 * - Accepts engagement reports for past selections
 * - Exposes cache, engagement and source ranking diagnostics
 */
@RestController
@RequestMapping("/api/media")
@Slf4j
public class MediaSelectionController {

    private final MediaSelectionEngine selectionEngine;
    private final SelectionResultCache resultCache;
    private final EngagementStore engagementStore;
    private final SourceOptimizer sourceOptimizer;
    private final int recentWindow;

    public MediaSelectionController(MediaSelectionEngine selectionEngine,
                                    SelectionResultCache resultCache,
                                    EngagementStore engagementStore,
                                    SourceOptimizer sourceOptimizer,
                                    AppConfigurationProperties properties) {
        this.selectionEngine = selectionEngine;
        this.resultCache = resultCache;
        this.engagementStore = engagementStore;
        this.sourceOptimizer = sourceOptimizer;
        this.recentWindow = properties.getEngagement().getRecentWindow();
    }

    /**
     * Selects an image for an event; "no image" is a normal 200 response with {@code accepted=false}
     */
    @PostMapping("/selections")
    public CompletableFuture<ResponseEntity<SelectionResponse>> select(@Valid @RequestBody SelectionRequest request) {
        HistoricalEvent event = new HistoricalEvent(request.year(), request.description());
        log.info("Selection requested for {}", event.logLabel());
        return selectionEngine.selectImageAsync(event, request.generatedText(), request.recentSources())
            .thenApply(outcome -> ResponseEntity.ok(SelectionResponse.from(outcome)));
    }

    @PostMapping("/selections/{selectionId}/engagement")
    public ResponseEntity<Map<String, String>> recordEngagement(@PathVariable String selectionId,
                                                                @Valid @RequestBody EngagementRequest request) {
        boolean applied = selectionEngine.recordEngagement(selectionId, request.toMetrics());
        if (!applied) {
            log.info("Engagement for selection {} not applied", selectionId);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(engagementBody("not_recorded", selectionId,
                "selection is unknown or already has engagement"));
        }
        return ResponseEntity.ok(engagementBody("recorded", selectionId, null));
    }

    private static Map<String, String> engagementBody(String status, String selectionId, String reason) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("selectionId", selectionId);
        if (reason != null) {
            body.put("reason", reason);
        }
        return body;
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return resultCache.stats();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        log.warn("Result cache clear requested");
        resultCache.clear();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sources")
    public SourceRankingResponse sources() {
        return new SourceRankingResponse(sourceOptimizer.order(), sourceOptimizer.recentSources(recentWindow),
            sourceOptimizer.rankedSources());
    }

    @GetMapping("/engagement/stats")
    public EngagementStats engagementStats() {
        return engagementStore.stats();
    }
}
