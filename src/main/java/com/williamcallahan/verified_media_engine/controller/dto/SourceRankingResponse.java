package com.williamcallahan.verified_media_engine.controller.dto;

import com.williamcallahan.verified_media_engine.model.engagement.SourcePerformance;

import java.util.List;

/**
 * Current source order with the data behind it
 *
 * @param order every configured source, best first
 * @param recentSources sources of the most recent selections, oldest first
 * @param performance per-source engagement aggregates, best first
 */
public record SourceRankingResponse(List<String> order,
                                    List<String> recentSources,
                                    List<SourcePerformance> performance) {
}
