package com.williamcallahan.verified_media_engine.model.selection;

import com.williamcallahan.verified_media_engine.model.image.ImageCandidate;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;

import java.util.Comparator;

/**
 * Candidate with its verification, style classification and combined ranking score
 *
 * @param candidate the quality-approved image
 * @param verification oracle verdict for the image
 * @param style style classification
 * @param styleScore learned style preference, 0-100
 * @param sourcePriorityIndex position of the source in the registry, lower wins ties
 */
public record ScoredCandidate(ImageCandidate candidate,
                              VerificationResult verification,
                              StyleProfile style,
                              double styleScore,
                              int sourcePriorityIndex) {

    public static final double CONFIDENCE_WEIGHT = 0.7;
    public static final double STYLE_WEIGHT = 0.3;

    /**
     * Best first: combined score descending, then declared source priority ascending
     */
    public static final Comparator<ScoredCandidate> RANKING =
        Comparator.comparingDouble(ScoredCandidate::combinedScore).reversed()
            .thenComparingInt(ScoredCandidate::sourcePriorityIndex);

    public double combinedScore() {
        return CONFIDENCE_WEIGHT * verification.confidence() + STYLE_WEIGHT * styleScore;
    }

    public String sourceName() {
        return candidate.sourceName();
    }
}
