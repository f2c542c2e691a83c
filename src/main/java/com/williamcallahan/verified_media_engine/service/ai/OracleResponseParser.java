package com.williamcallahan.verified_media_engine.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.verified_media_engine.model.verification.StyleProfile;
import com.williamcallahan.verified_media_engine.model.verification.Verdict;
import com.williamcallahan.verified_media_engine.model.verification.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Defensive parsing of oracle answers
 *
 * Features:
 * - Strips markdown code fences around the JSON
 * - Falls back to the outermost brace-delimited block when the text has chatter around it
 * - Fills every missing field with its default instead of failing
 */
@Component
public class OracleResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(OracleResponseParser.class);

    private final ObjectMapper objectMapper;

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Verification answer; unparseable text yields an ERROR result
     */
    public VerificationResult parseVerification(String raw) {
        Optional<JsonNode> parsed = parseObject(raw);
        if (parsed.isEmpty()) {
            return VerificationResult.error("Unparseable oracle response");
        }
        JsonNode node = parsed.get();
        return new VerificationResult(
            Verdict.fromOracle(text(node, "verdict")),
            confidence(node.get("confidence")),
            text(node, "reasoning"),
            text(node, "visualDescription"));
    }

    /**
     * Style answer; anything missing or unparseable becomes "unknown"
     */
    public StyleProfile parseStyle(String raw) {
        return parseObject(raw)
            .map(node -> new StyleProfile(text(node, "type"), text(node, "era"), text(node, "colorScheme")))
            .orElseGet(StyleProfile::unknown);
    }

    Optional<JsonNode> parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = stripFences(raw.trim());
        Optional<JsonNode> direct = readObject(cleaned);
        if (direct.isPresent()) {
            return direct;
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return readObject(cleaned.substring(start, end + 1));
        }
        logger.warn("Oracle response contained no JSON object: {}", abbreviate(raw));
        return Optional.empty();
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
        int closing = body.lastIndexOf("```");
        return (closing >= 0 ? body.substring(0, closing) : body).trim();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private static int confidence(JsonNode value) {
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return (int) Math.round(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return (int) Math.round(Double.parseDouble(value.asText().replace("%", "").trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static String abbreviate(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}
