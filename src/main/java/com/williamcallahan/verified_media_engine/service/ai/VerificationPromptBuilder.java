package com.williamcallahan.verified_media_engine.service.ai;

import com.williamcallahan.verified_media_engine.model.HistoricalEvent;
import com.williamcallahan.verified_media_engine.model.image.CandidateMetadata;
import com.williamcallahan.verified_media_engine.model.image.ImageCandidate;
import org.springframework.stereotype.Component;

/**
 * Builds the oracle prompts for match verification and style classification
 */
@Component
public class VerificationPromptBuilder {

    static final String VERIFY_SYSTEM_PROMPT =
        "Expert at verifying historical image accuracy using visual analysis. Respond in JSON.";

    static final String STYLE_PROMPT = """
        Analyze this image's visual style. Respond in JSON:
        {
          "type": "photograph" | "illustration" | "painting" | "engraving" | "map" | "document",
          "era": "modern" | "vintage" | "historical" | "ancient",
          "colorScheme": "color" | "black-and-white" | "sepia"
        }""";

    public VisionRequest verificationRequest(ImageCandidate candidate, HistoricalEvent event, String generatedText) {
        return new VisionRequest("verify", VERIFY_SYSTEM_PROMPT,
            verificationPrompt(candidate, event, generatedText), candidate.imageBytes(), "high");
    }

    public VisionRequest styleRequest(ImageCandidate candidate) {
        return new VisionRequest("style", null, STYLE_PROMPT, candidate.imageBytes(), "low");
    }

    String verificationPrompt(ImageCandidate candidate, HistoricalEvent event, String generatedText) {
        CandidateMetadata metadata = candidate.metadata();
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are verifying that an image matches a historical event. Be strict but fair.\n\n");
        prompt.append("EVENT:\n");
        prompt.append("Year: ").append(event.year()).append('\n');
        prompt.append("Description: ").append(event.description()).append("\n\n");
        prompt.append("POST CONTENT:\n\"").append(generatedText == null ? "" : generatedText).append("\"\n\n");
        prompt.append("IMAGE METADATA:\n");
        prompt.append("Source: ").append(candidate.sourceName()).append('\n');
        if (metadata != null) {
            appendIfPresent(prompt, "Search Term Used", metadata.searchTerm());
            appendIfPresent(prompt, "URL", metadata.url());
            appendIfPresent(prompt, "Title", metadata.title());
            appendIfPresent(prompt, "Date", metadata.date());
        }
        prompt.append("""

            ANALYZE THE ACTUAL IMAGE:
            1. Look at what the image actually shows
            2. Check if it matches the person, event or time period described
            3. Look for name mismatches (a different person with a similar title is WRONG)
            4. Check for anachronisms (modern photos for old events are WRONG)
            5. Generic historical photos from the correct era are OK if relevant

            Respond in JSON:
            {
              "confidence": 85,
              "verdict": "APPROVED" | "QUESTIONABLE" | "WRONG",
              "reasoning": "Specific explanation based on what you see in the image",
              "visualDescription": "Brief description of what the image shows"
            }

            GUIDELINES:
            - APPROVED (70-100): clearly shows the event, person or era, or is a relevant photo from the correct period
            - QUESTIONABLE (50-69): generic historical image, loosely related but not specific
            - WRONG (0-49): wrong person, wrong era, modern photo, or unrelated""");
        return prompt.toString();
    }

    private static void appendIfPresent(StringBuilder prompt, String label, String value) {
        if (value != null && !value.isBlank()) {
            prompt.append(label).append(": ").append(value).append('\n');
        }
    }
}
