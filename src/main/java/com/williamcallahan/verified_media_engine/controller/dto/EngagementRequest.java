package com.williamcallahan.verified_media_engine.controller.dto;

import com.williamcallahan.verified_media_engine.model.engagement.EngagementMetrics;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Body of {@code POST /api/media/selections/{id}/engagement}; missing counts mean zero
 */
public record EngagementRequest(@PositiveOrZero Long likes,
                                @PositiveOrZero Long retweets,
                                @PositiveOrZero Long replies,
                                @PositiveOrZero Long impressions) {

    public EngagementMetrics toMetrics() {
        return new EngagementMetrics(orZero(likes), orZero(retweets), orZero(replies), orZero(impressions));
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
