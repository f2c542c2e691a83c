package com.williamcallahan.verified_media_engine.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code POST /api/media/selections}
 *
 * @param year event year
 * @param description event description
 * @param generatedText post copy the image will accompany, may be null
 * @param recentSources optional override of the recent-source window
 */
public record SelectionRequest(@NotNull Integer year,
                               @NotBlank String description,
                               String generatedText,
                               List<String> recentSources) {
}
