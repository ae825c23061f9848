package com.purchasingpower.forge.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;

import java.util.List;

/**
 * The two vector collections of one conversation.
 *
 * <p>Every mutation is persisted before it returns. Storage failures surface as
 * {@link com.purchasingpower.forge.exception.StorageUnavailableException}.
 */
public interface VectorIndex {

    /**
     * Insert or replace records by id.
     */
    void upsert(VectorCollection collection, List<VectorRecord> records);

    /**
     * Nearest neighbours by cosine similarity, best first.
     *
     * @param filter metadata filter, or null for none
     */
    List<VectorMatch> query(VectorCollection collection, Embedding queryVector, int maxResults, Filter filter);

    /**
     * @return number of records removed
     */
    int removeWhere(VectorCollection collection, String metadataKey, Object value);

    int count(VectorCollection collection);

    /**
     * Fails fast when the backing storage cannot be written.
     */
    void ensureAvailable();
}
