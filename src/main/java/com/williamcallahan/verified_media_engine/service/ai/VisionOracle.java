package com.williamcallahan.verified_media_engine.service.ai;

import java.util.concurrent.CompletableFuture;

/**
 * Opaque AI vision capability
 * - Completes with the raw text the model produced, expected to be a JSON object
 * - Completes exceptionally on transport failure; callers never trust the shape of the answer
 */
public interface VisionOracle {

    CompletableFuture<String> complete(VisionRequest request);
}
