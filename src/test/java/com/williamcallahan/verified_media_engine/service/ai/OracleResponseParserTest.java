package com.williamcallahan.verified_media_engine.service.ai;

import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;
import com.williamcallahan.verified_media_engine.testutil.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OracleResponseParserTest {

    private final OracleResponseParser parser = new OracleResponseParser(TestFixtures.objectMapper());

    @Test
    void parsesAPlainJsonAnswer() {
        VerificationResult result = parser.parseVerification("""
            {"confidence": 88, "verdict": "APPROVED", "reasoning": "Shows the lunar module", "visualDescription": "Astronaut on the moon"}
            """);

        assertThat(result.verdict()).isEqualTo(Verdict.APPROVED);
        assertThat(result.confidence()).isEqualTo(88);
        assertThat(result.reasoning()).isEqualTo("Shows the lunar module");
        assertThat(result.visualDescription()).isEqualTo("Astronaut on the moon");
        assertThat(result.isAcceptable()).isTrue();
    }

    @Test
    void stripsMarkdownFences() {
        VerificationResult result = parser.parseVerification("""
            ```json
            {"confidence": 72, "verdict": "approved"}
            ```""");

        assertThat(result.verdict()).isEqualTo(Verdict.APPROVED);
        assertThat(result.confidence()).isEqualTo(72);
    }

    @Test
    void extractsTheObjectFromSurroundingChatter() {
        VerificationResult result = parser.parseVerification(
            "Sure! Here is my analysis: {\"confidence\": \"65%\", \"verdict\": \"QUESTIONABLE\"} Hope that helps.");

        assertThat(result.verdict()).isEqualTo(Verdict.QUESTIONABLE);
        assertThat(result.confidence()).isEqualTo(65);
    }

    @Test
    void fillsMissingFieldsWithDefaults() {
        VerificationResult result = parser.parseVerification("{\"reasoning\": \"hard to tell\"}");

        assertThat(result.verdict()).isEqualTo(Verdict.QUESTIONABLE);
        assertThat(result.confidence()).isZero();
        assertThat(result.visualDescription()).isEmpty();
    }

    @Test
    void clampsConfidenceAndToleratesUnknownVerdicts() {
        VerificationResult result = parser.parseVerification("{\"confidence\": 140, \"verdict\": \"MAYBE\"}");

        assertThat(result.confidence()).isEqualTo(100);
        assertThat(result.verdict()).isEqualTo(Verdict.QUESTIONABLE);
        assertThat(result.isAcceptable()).isFalse();
    }

    @Test
    void unparseableAnswersBecomeErrors() {
        assertThat(parser.parseVerification("I cannot help with that").verdict()).isEqualTo(Verdict.ERROR);
        assertThat(parser.parseVerification(null).verdict()).isEqualTo(Verdict.ERROR);
        assertThat(parser.parseVerification("[1, 2, 3]").confidence()).isZero();
    }

    @Test
    void parsesStyleWithUnknownFallbacks() {
        StyleProfile full = parser.parseStyle("{\"type\": \"Photograph\", \"era\": \"vintage\", \"colorScheme\": \"sepia\"}");
        StyleProfile partial = parser.parseStyle("{\"type\": \"painting\"}");

        assertThat(full).isEqualTo(new StyleProfile("photograph", "vintage", "sepia"));
        assertThat(partial.era()).isEqualTo(StyleProfile.UNKNOWN);
        assertThat(parser.parseStyle("nonsense")).isEqualTo(StyleProfile.unknown());
    }
}
