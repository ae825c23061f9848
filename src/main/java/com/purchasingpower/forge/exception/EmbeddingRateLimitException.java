package com.purchasingpower.forge.exception;

/**
 * The embedding service answered 429. Always retryable.
 */
public class EmbeddingRateLimitException extends EmbeddingException {

    public EmbeddingRateLimitException(String message) {
        super(message, 429, true);
    }
}
