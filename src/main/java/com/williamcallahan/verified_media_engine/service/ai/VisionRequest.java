package com.williamcallahan.verified_media_engine.service.ai;

/**
 * One image-plus-prompt question for the vision oracle
 *
 * @param purpose short label used in logs ("verify", "style")
 * @param systemPrompt instructions for the model, may be null
 * @param userPrompt question about the image
 * @param imageBytes image payload, sent inline as base64
 * @param detail requested image detail level, "high" or "low"
 */
public record VisionRequest(String purpose, String systemPrompt, String userPrompt, byte[] imageBytes, String detail) {
}
