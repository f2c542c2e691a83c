package com.williamcallahan.verified_media_engine.source;

/**
 * Read-only description of a configured image source
 *
 * @param name unique registry name
 * @param enabled disabled sources are ranked but never fetched
 * @param priorityRank lower ranks come first in registry order
 * @param reliabilityScore informational 0-100 trust score
 * @param timeoutMs per-fetch timeout
 */
public record ImageSource(String name, boolean enabled, int priorityRank, int reliabilityScore, long timeoutMs) {
}
