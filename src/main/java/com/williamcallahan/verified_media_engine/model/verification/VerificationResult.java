package com.williamcallahan.verified_media_engine.model.verification;

/**
 * Parsed oracle judgment for one candidate
 *
 * @param verdict categorical verdict, never null
 * @param confidence 0-100
 * @param reasoning explanation from the oracle, empty when absent
 * @param visualDescription what the oracle saw in the image, empty when absent
 */
public record VerificationResult(Verdict verdict, int confidence, String reasoning, String visualDescription) {

    public static final int ACCEPT_CONFIDENCE_THRESHOLD = 70;

    public VerificationResult {
        verdict = verdict == null ? Verdict.QUESTIONABLE : verdict;
        confidence = Math.max(0, Math.min(100, confidence));
        reasoning = reasoning == null ? "" : reasoning;
        visualDescription = visualDescription == null ? "" : visualDescription;
    }

    public static VerificationResult error(String reason) {
        return new VerificationResult(Verdict.ERROR, 0, reason, "");
    }

    /**
     * Whether this result alone is good enough for an image to be used
     */
    public boolean isAcceptable() {
        return verdict == Verdict.APPROVED && confidence >= ACCEPT_CONFIDENCE_THRESHOLD;
    }
}
