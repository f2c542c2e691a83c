package com.williamcallahan.verified_media_engine.model.selection;

import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;

import java.util.Optional;

/**
 * Result of a selection: either an accepted image or "no image"
 * - Accepted outcomes carry the image bytes and their scoring metadata
 * - Rejected outcomes carry the reason and, when scoring ran, the best attempt
 */
public final class SelectionOutcome {

    private final boolean accepted;
    private final String selectionId;
    private final byte[] imageBytes;
    private final String source;
    private final int confidence;
    private final Verdict verdict;
    private final StyleProfile styleInfo;
    private final double combinedScore;
    private final boolean fromCache;
    private final String rejectionReason;
    private final ScoredCandidate bestAttempt;

    private SelectionOutcome(boolean accepted, String selectionId, byte[] imageBytes, String source,
                             int confidence, Verdict verdict, StyleProfile styleInfo, double combinedScore,
                             boolean fromCache, String rejectionReason, ScoredCandidate bestAttempt) {
        this.accepted = accepted;
        this.selectionId = selectionId;
        this.imageBytes = imageBytes;
        this.source = source;
        this.confidence = confidence;
        this.verdict = verdict;
        this.styleInfo = styleInfo;
        this.combinedScore = combinedScore;
        this.fromCache = fromCache;
        this.rejectionReason = rejectionReason;
        this.bestAttempt = bestAttempt;
    }

    public static SelectionOutcome accepted(String selectionId, ScoredCandidate winner) {
        return new SelectionOutcome(true, selectionId, winner.candidate().imageBytes(), winner.sourceName(),
            winner.verification().confidence(), winner.verification().verdict(), winner.style(),
            winner.combinedScore(), false, null, null);
    }

    public static SelectionOutcome acceptedFromCache(String selectionId, byte[] imageBytes, String source,
                                                     int confidence, Verdict verdict, StyleProfile styleInfo) {
        return new SelectionOutcome(true, selectionId, imageBytes, source, confidence, verdict, styleInfo,
            Double.NaN, true, null, null);
    }

    public static SelectionOutcome rejected(String reason) {
        return rejected(reason, null);
    }

    public static SelectionOutcome rejected(String reason, ScoredCandidate bestAttempt) {
        return new SelectionOutcome(false, null, null, null, 0, null, null, Double.NaN, false, reason, bestAttempt);
    }

    public boolean isAccepted() { return accepted; }
    public String getSelectionId() { return selectionId; }
    public byte[] getImageBytes() { return imageBytes; }
    public String getSource() { return source; }
    public int getConfidence() { return confidence; }
    public Verdict getVerdict() { return verdict; }
    public StyleProfile getStyleInfo() { return styleInfo; }

    /**
     * NaN for cache hits and rejections, the combined ranking score otherwise
     */
    public double getCombinedScore() { return combinedScore; }
    public boolean isFromCache() { return fromCache; }
    public String getRejectionReason() { return rejectionReason; }
    public Optional<ScoredCandidate> getBestAttempt() { return Optional.ofNullable(bestAttempt); }

    @Override
    public String toString() {
        if (accepted) {
            return "Accepted{source=" + source + ", confidence=" + confidence + ", verdict=" + verdict
                + ", fromCache=" + fromCache + ", selectionId=" + selectionId + "}";
        }
        return "Rejected{reason=" + rejectionReason + "}";
    }
}
