package com.purchasingpower.forge.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.embedding.EmbeddingClient;
import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.configuration.RetrievalProperties;
import com.purchasingpower.forge.model.chunk.LeafChunk;
import com.purchasingpower.forge.model.retrieval.RetrievedDocument;
import com.purchasingpower.forge.model.retrieval.RetrievedTurn;
import com.purchasingpower.forge.model.retrieval.TurnRecord;
import com.purchasingpower.forge.vector.MetadataKeys;
import com.purchasingpower.forge.vector.VectorCollection;
import com.purchasingpower.forge.vector.VectorIndex;
import com.purchasingpower.forge.vector.VectorMatch;
import com.purchasingpower.forge.vector.VectorRecord;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.store.embedding.filter.Filter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Writes to and reads from the two vector collections of a conversation.
 *
 * <p>Documents: leaves are embedded with their context header; queries over-fetch twice the
 * result count and keep the best leaf per parent. Conversations: one record per turn, only turns
 * older than the always-on window are returned, oldest first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorRetrievalService {

    private final EmbeddingClient embeddingClient;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    // ---------------------------------------------------------------- documents

    /**
     * Replaces every chunk of the source with the given ones.
     *
     * @return number of chunks stored
     */
    public int indexDocument(VectorIndex index, String sourceId, List<LeafChunk> chunks) {
        if (chunks.isEmpty()) {
            index.removeWhere(VectorCollection.DOCUMENTS, MetadataKeys.SOURCE_ID, sourceId);
            return 0;
        }
        List<String> texts = chunks.stream().map(c -> c.getContextHeader() + "\n" + c.getText()).toList();
        List<Embedding> embeddings = embeddingClient.embedDocuments(texts);

        List<VectorRecord> records = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            LeafChunk chunk = chunks.get(i);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(MetadataKeys.SOURCE_ID, sourceId);
            metadata.put(MetadataKeys.HEADER_PATH, toJson(chunk.getHeaderPath()));
            metadata.put(MetadataKeys.CONTEXT_HEADER, chunk.getContextHeader());
            metadata.put(MetadataKeys.PARENT_TEXT, chunk.getParentText());
            metadata.put(MetadataKeys.PARENT_ID, chunk.getParentId());
            metadata.put(MetadataKeys.LEAF_INDEX, chunk.getLeafIndex());
            records.add(new VectorRecord(chunk.id(), embeddings.get(i).vector(), texts.get(i), metadata));
        }

        index.removeWhere(VectorCollection.DOCUMENTS, MetadataKeys.SOURCE_ID, sourceId);
        index.upsert(VectorCollection.DOCUMENTS, records);
        log.info("Ingested {}: {} chunks", sourceId, records.size());
        return records.size();
    }

    public int removeDocument(VectorIndex index, String sourceId) {
        int removed = index.removeWhere(VectorCollection.DOCUMENTS, MetadataKeys.SOURCE_ID, sourceId);
        log.info("Removed {}: {} chunks deleted", sourceId, removed);
        return removed;
    }

    /**
     * @param sourceFilter restrict to one source, or null
     */
    public List<RetrievedDocument> retrieveDocuments(VectorIndex index, String query, String sourceFilter) {
        int available = index.count(VectorCollection.DOCUMENTS);
        if (available == 0) {
            return List.of();
        }
        int wanted = appProperties.getRetrieval().getMaxDocumentResults();
        Filter filter = sourceFilter == null ? null : metadataKey(MetadataKeys.SOURCE_ID).isEqualTo(sourceFilter);

        List<VectorMatch> matches = index.query(VectorCollection.DOCUMENTS, embeddingClient.embedQuery(query),
                Math.min(wanted * 2, available), filter);

        Set<String> seenParents = new HashSet<>();
        List<RetrievedDocument> documents = new ArrayList<>();
        for (VectorMatch match : matches) {
            if (!seenParents.add(match.stringValue(MetadataKeys.PARENT_ID))) {
                continue;
            }
            documents.add(new RetrievedDocument(
                    match.stringValue(MetadataKeys.SOURCE_ID),
                    match.stringValue(MetadataKeys.CONTEXT_HEADER),
                    match.stringValue(MetadataKeys.PARENT_ID),
                    match.stringValue(MetadataKeys.PARENT_TEXT),
                    match.score()));
            if (documents.size() >= wanted) {
                break;
            }
        }
        documents.sort(Comparator.comparingDouble(RetrievedDocument::score).reversed());
        return documents;
    }

    // ---------------------------------------------------------------- conversations

    public void indexTurn(VectorIndex index, TurnRecord turn) {
        Embedding embedding = embeddingClient.embedDocuments(List.of(turn.getSummary())).get(0);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.TURN_NUMBER, turn.getTurnNumber());
        metadata.put(MetadataKeys.ACTIVE_PROBE, nullToEmpty(turn.getActiveProbe()));
        metadata.put(MetadataKeys.ACTIVE_MODE, nullToEmpty(turn.getActiveMode()));
        metadata.put(MetadataKeys.USER_MESSAGE, nullToEmpty(turn.getUserMessage()));
        metadata.put(MetadataKeys.ASSISTANT_RESPONSE, nullToEmpty(turn.getAssistantResponse()));

        index.upsert(VectorCollection.CONVERSATIONS,
                List.of(new VectorRecord(turn.id(), embedding.vector(), turn.getSummary(), metadata)));
        log.info("Indexed turn {}", turn.getTurnNumber());
    }

    /**
     * Older turns relevant to the query, in chronological order. Empty while every turn is still
     * inside the always-on window.
     *
     * @param probeFilter restrict to turns recorded under this guidance key, or null
     */
    public List<RetrievedTurn> retrieveConversations(VectorIndex index, String query, int currentTurn, String probeFilter) {
        RetrievalProperties retrieval = appProperties.getRetrieval();
        int threshold = currentTurn - retrieval.getAlwaysOnWindow();
        if (threshold <= 0) {
            return List.of();
        }
        int available = index.count(VectorCollection.CONVERSATIONS);
        if (available == 0) {
            return List.of();
        }

        Filter filter = metadataKey(MetadataKeys.TURN_NUMBER).isLessThan(threshold);
        if (probeFilter != null) {
            filter = filter.and(metadataKey(MetadataKeys.ACTIVE_PROBE).isEqualTo(probeFilter));
        }

        List<VectorMatch> matches = index.query(VectorCollection.CONVERSATIONS, embeddingClient.embedQuery(query),
                Math.min(retrieval.getMaxConversationResults(), available), filter);

        List<RetrievedTurn> turns = new ArrayList<>();
        for (VectorMatch match : matches) {
            turns.add(new RetrievedTurn(
                    match.intValue(MetadataKeys.TURN_NUMBER),
                    match.stringValue(MetadataKeys.ACTIVE_PROBE),
                    match.stringValue(MetadataKeys.ACTIVE_MODE),
                    match.stringValue(MetadataKeys.USER_MESSAGE),
                    match.stringValue(MetadataKeys.ASSISTANT_RESPONSE),
                    match.score()));
        }
        turns.sort(Comparator.comparingInt(RetrievedTurn::turnNumber));
        return turns;
    }

    private String toJson(List<String> headerPath) {
        try {
            return objectMapper.writeValueAsString(headerPath);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise header path " + headerPath, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
