package com.purchasingpower.forge.client.embedding;

import dev.langchain4j.data.embedding.Embedding;

import java.util.List;

/**
 * Boundary to the embedding backend. Vectors come back in input order.
 */
public interface EmbeddingClient {

    /**
     * @throws com.purchasingpower.forge.exception.EmbeddingRateLimitException when still rate limited
     *         after retries
     * @throws com.purchasingpower.forge.exception.EmbeddingException for any other failure
     */
    List<Embedding> embedDocuments(List<String> texts);

    Embedding embedQuery(String text);
}
