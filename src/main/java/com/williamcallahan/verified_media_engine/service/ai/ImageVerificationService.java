package com.williamcallahan.verified_media_engine.service.ai;

import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.image.ImageCandidate;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;
import com.williamcallahan.verified_media_engine.monitoring.MetricsService;
import com.williamcallahan.verified_media_engine.util.AsyncUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Asks the vision oracle whether a candidate matches an event and how it looks
 * - Both futures always complete normally
 * - Any oracle or parse failure becomes an ERROR verdict with confidence 0
 * - Style failures become an all-unknown profile
 */
@Service
public class ImageVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(ImageVerificationService.class);

    private final VisionOracle visionOracle;
    private final VerificationPromptBuilder promptBuilder;
    private final OracleResponseParser responseParser;
    private final MetricsService metricsService;
    private final Executor oracleExecutor;

    public ImageVerificationService(VisionOracle visionOracle,
                                    VerificationPromptBuilder promptBuilder,
                                    OracleResponseParser responseParser,
                                    MetricsService metricsService,
                                    @Qualifier("oracleExecutor") Executor oracleExecutor) {
        this.visionOracle = visionOracle;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.metricsService = metricsService;
        this.oracleExecutor = oracleExecutor;
    }

    /**
     * Verifies a candidate against the event and the text it will accompany
     */
    public CompletableFuture<VerificationResult> verify(ImageCandidate candidate, HistoricalEvent event, String generatedText) {
        CompletableFuture<String> call;
        try {
            call = visionOracle.complete(promptBuilder.verificationRequest(candidate, event, generatedText));
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handleAsync((raw, ex) -> {
            VerificationResult result;
            if (ex != null) {
                Throwable cause = AsyncUtils.unwrap(ex);
                logger.warn("Verification of {} candidate for {} failed: {}",
                    candidate.sourceName(), event.logLabel(), cause.getMessage());
                result = VerificationResult.error(cause.getMessage());
            } else {
                result = responseParser.parseVerification(raw);
            }
            if (result.verdict() == Verdict.ERROR) {
                metricsService.incrementOracleError();
            }
            logger.info("Verification of {} candidate for {}: {} ({}%)",
                candidate.sourceName(), event.logLabel(), result.verdict(), result.confidence());
            return result;
        }, oracleExecutor);
    }

    /**
     * Classifies the visual style of a candidate
     */
    public CompletableFuture<StyleProfile> analyzeStyle(ImageCandidate candidate) {
        CompletableFuture<String> call;
        try {
            call = visionOracle.complete(promptBuilder.styleRequest(candidate));
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handleAsync((raw, ex) -> {
            if (ex != null) {
                logger.warn("Style analysis of {} candidate failed: {}", candidate.sourceName(), AsyncUtils.unwrap(ex).getMessage());
                return StyleProfile.unknown();
            }
            StyleProfile profile = responseParser.parseStyle(raw);
            logger.debug("Style of {} candidate: {}", candidate.sourceName(), profile);
            return profile;
        }, oracleExecutor);
    }
}
