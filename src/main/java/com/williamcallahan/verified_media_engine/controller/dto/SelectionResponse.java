package com.williamcallahan.verified_media_engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.verified_media_engine.model.selection.ScoredCandidate;
import com.williamcallahan.verified_media_engine.model.selection.SelectionOutcome;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;

import java.util.Base64;

/**
 * JSON view of a selection outcome; image bytes are base64 encoded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SelectionResponse(boolean accepted,
                                String selectionId,
                                String source,
                                Integer confidence,
                                Verdict verdict,
                                StyleProfile style,
                                Double combinedScore,
                                Boolean fromCache,
                                String imageBase64,
                                String rejectionReason,
                                BestAttempt bestAttempt) {

    public static SelectionResponse from(SelectionOutcome outcome) {
        if (!outcome.isAccepted()) {
            return new SelectionResponse(false, null, null, null, null, null, null, null, null,
                outcome.getRejectionReason(), outcome.getBestAttempt().map(BestAttempt::from).orElse(null));
        }
        Double combined = Double.isNaN(outcome.getCombinedScore()) ? null : outcome.getCombinedScore();
        return new SelectionResponse(true, outcome.getSelectionId(), outcome.getSource(), outcome.getConfidence(),
            outcome.getVerdict(), outcome.getStyleInfo(), combined, outcome.isFromCache(),
            Base64.getEncoder().encodeToString(outcome.getImageBytes()), null, null);
    }

    /**
     * Scoring summary of the best rejected candidate
     */
    public record BestAttempt(String source, Verdict verdict, int confidence, String reasoning, double combinedScore) {

        static BestAttempt from(ScoredCandidate candidate) {
            return new BestAttempt(candidate.sourceName(), candidate.verification().verdict(),
                candidate.verification().confidence(), candidate.verification().reasoning(), candidate.combinedScore());
        }
    }
}
