package com.purchasingpower.forge.client.generation;

/**
 * Boundary to the text generation backend.
 */
public interface GenerationClient {

    /**
     * @throws com.purchasingpower.forge.exception.GenerationException on transport failure,
     *         timeout or a non-retryable error response
     */
    GenerationResponse generate(GenerationRequest request);
}
