package com.williamcallahan.verified_media_engine.controller;

import com.williamcallahan.verified_media_engine.config.AppConfigurationProperties;
import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.cache.CacheStats;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementMetrics;
import com.williamcallahan.verified_media_engine.model.engagement.EngagementStats;
import com.williamcallahan.verified_media_engine.model.engagement.SourcePerformance;
import com.williamcallahan.verified_media_engine.model.image.ImageCandidate;
import com.williamcallahan.verified_media_engine.model.selection.ScoredCandidate;
import com.williamcallahan.verified_media_engine.model.selection.SelectionOutcome;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;
import com.williamcallahan.verified_media_engine.service.cache.SelectionResultCache;
import com.williamcallahan.verified_media_engine.service.engagement.EngagementStore;
import com.williamcallahan.verified_media_engine.service.ranking.SourceOptimizer;
import com.williamcallahan.verified_media_engine.service.selection.MediaSelectionEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MediaSelectionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(AppConfigurationProperties.class)
class MediaSelectionControllerTest {

    private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x01, 0x02};

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MediaSelectionEngine selectionEngine;

    @MockitoBean
    private SelectionResultCache resultCache;

    @MockitoBean
    private EngagementStore engagementStore;

    @MockitoBean
    private SourceOptimizer sourceOptimizer;

    @Test
    @DisplayName("accepted selection returns the image inline with its scoring")
    void returnsAcceptedSelection() throws Exception {
        ScoredCandidate winner = scored("Wikipedia", Verdict.APPROVED, 88);
        given(selectionEngine.selectImageAsync(any(HistoricalEvent.class), anyString(), isNull()))
            .willReturn(CompletableFuture.completedFuture(SelectionOutcome.accepted("sel-1", winner)));

        MvcResult pending = mockMvc.perform(post("/api/media/selections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"year\": 1969, \"description\": \"Apollo 11 lands on the Moon\","
                    + " \"generatedText\": \"One small step\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accepted").value(true))
            .andExpect(jsonPath("$.selectionId").value("sel-1"))
            .andExpect(jsonPath("$.source").value("Wikipedia"))
            .andExpect(jsonPath("$.confidence").value(88))
            .andExpect(jsonPath("$.verdict").value("APPROVED"))
            .andExpect(jsonPath("$.combinedScore", closeTo(76.6, 1e-9)))
            .andExpect(jsonPath("$.fromCache").value(false))
            .andExpect(jsonPath("$.imageBase64").value(Base64.getEncoder().encodeToString(IMAGE)))
            .andExpect(jsonPath("$.rejectionReason").doesNotExist());

        ArgumentCaptor<HistoricalEvent> event = ArgumentCaptor.forClass(HistoricalEvent.class);
        then(selectionEngine).should().selectImageAsync(event.capture(), eq("One small step"), isNull());
        assertThat(event.getValue()).isEqualTo(new HistoricalEvent(1969, "Apollo 11 lands on the Moon"));
    }

    @Test
    void noImageIsAnOrdinaryResponse() throws Exception {
        ScoredCandidate best = scored("Wikipedia", Verdict.APPROVED, 69);
        given(selectionEngine.selectImageAsync(any(HistoricalEvent.class), isNull(), eq(List.of("Smithsonian"))))
            .willReturn(CompletableFuture.completedFuture(SelectionOutcome.rejected(
                "best candidate from Wikipedia was APPROVED at 69% (needs APPROVED at 70%)", best)));

        MvcResult pending = mockMvc.perform(post("/api/media/selections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"year\": 1969, \"description\": \"Apollo 11\", \"recentSources\": [\"Smithsonian\"]}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accepted").value(false))
            .andExpect(jsonPath("$.rejectionReason")
                .value("best candidate from Wikipedia was APPROVED at 69% (needs APPROVED at 70%)"))
            .andExpect(jsonPath("$.bestAttempt.source").value("Wikipedia"))
            .andExpect(jsonPath("$.bestAttempt.confidence").value(69))
            .andExpect(jsonPath("$.imageBase64").doesNotExist());
    }

    @Test
    void rejectsSelectionWithoutDescription() throws Exception {
        mockMvc.perform(post("/api/media/selections")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"year\": 1969, \"description\": \"  \"}"))
            .andExpect(status().isBadRequest());

        then(selectionEngine).shouldHaveNoInteractions();
    }

    @Test
    void recordsEngagement() throws Exception {
        given(selectionEngine.recordEngagement(eq("sel-1"), any(EngagementMetrics.class))).willReturn(true);

        mockMvc.perform(post("/api/media/selections/sel-1/engagement")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"likes\": 40, \"retweets\": 5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("recorded"))
            .andExpect(jsonPath("$.selectionId").value("sel-1"))
            .andExpect(jsonPath("$.reason").doesNotExist());

        then(selectionEngine).should().recordEngagement("sel-1", new EngagementMetrics(40, 5, 0, 0));
    }

    @Test
    void repeatedEngagementIsAConflict() throws Exception {
        given(selectionEngine.recordEngagement(eq("sel-1"), any(EngagementMetrics.class))).willReturn(false);

        mockMvc.perform(post("/api/media/selections/sel-1/engagement")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"likes\": 1}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.status").value("not_recorded"))
            .andExpect(jsonPath("$.selectionId").value("sel-1"))
            .andExpect(jsonPath("$.reason").value("selection is unknown or already has engagement"));
    }

    @Test
    void negativeCountsAreRejected() throws Exception {
        mockMvc.perform(post("/api/media/selections/sel-1/engagement")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"likes\": -3}"))
            .andExpect(status().isBadRequest());

        then(selectionEngine).should(never()).recordEngagement(anyString(), any());
    }

    @Test
    void exposesCacheStats() throws Exception {
        given(resultCache.stats()).willReturn(new CacheStats(2, 5, 81.5, Instant.parse("2026-03-01T12:00:00Z")));

        mockMvc.perform(get("/api/media/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalEntries").value(2))
            .andExpect(jsonPath("$.totalUses").value(5))
            .andExpect(jsonPath("$.averageConfidence").value(81.5));
    }

    @Test
    void clearsCache() throws Exception {
        mockMvc.perform(delete("/api/media/cache"))
            .andExpect(status().isNoContent());

        then(resultCache).should().clear();
    }

    @Test
    void describesSourceRanking() throws Exception {
        given(sourceOptimizer.order()).willReturn(List.of("Wikipedia", "LibraryOfCongress"));
        given(sourceOptimizer.recentSources(5)).willReturn(List.of("LibraryOfCongress"));
        given(sourceOptimizer.rankedSources()).willReturn(List.of(new SourcePerformance("Wikipedia", 42.0, 6)));

        mockMvc.perform(get("/api/media/sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.order[0]").value("Wikipedia"))
            .andExpect(jsonPath("$.recentSources[0]").value("LibraryOfCongress"))
            .andExpect(jsonPath("$.performance[0].sourceName").value("Wikipedia"))
            .andExpect(jsonPath("$.performance[0].sampleCount").value(6));
    }

    @Test
    void exposesEngagementStats() throws Exception {
        given(engagementStore.stats()).willReturn(new EngagementStats(4, 2, 30.0, 4.0, 1.0));

        mockMvc.perform(get("/api/media/engagement/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalRecords").value(4))
            .andExpect(jsonPath("$.recordsWithMetrics").value(2));
    }

    private static ScoredCandidate scored(String source, Verdict verdict, int confidence) {
        ImageCandidate candidate = new ImageCandidate(source, IMAGE, null, null);
        VerificationResult verification = new VerificationResult(verdict, confidence, "looks right", "");
        return new ScoredCandidate(candidate, verification, new StyleProfile("photograph", "vintage", "color"), 50.0, 0);
    }
}
