package com.purchasingpower.forge.vector.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.exception.StorageUnavailableException;
import com.purchasingpower.forge.model.CallContext;
import com.purchasingpower.forge.model.ServiceType;
import com.purchasingpower.forge.util.ExternalCallLogger;
import com.purchasingpower.forge.vector.VectorCollection;
import com.purchasingpower.forge.vector.VectorIndex;
import com.purchasingpower.forge.vector.VectorMatch;
import com.purchasingpower.forge.vector.VectorRecord;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LangChain4j in-memory stores, one per collection, mirrored to a JSON file per collection.
 *
 * <p>The mirror keeps the raw records so a store can be rebuilt on load and filtered removals can
 * report what they removed. Files are written to a temp file and moved into place. A null
 * directory keeps everything in memory.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

    private static final TypeReference<List<StoredRecord>> RECORDS = new TypeReference<>() {
    };

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<VectorCollection, InMemoryEmbeddingStore<TextSegment>> stores = new EnumMap<>(VectorCollection.class);
    private final Map<VectorCollection, Map<String, VectorRecord>> records = new EnumMap<>(VectorCollection.class);

    public InMemoryVectorIndex(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        for (VectorCollection collection : VectorCollection.values()) {
            stores.put(collection, new InMemoryEmbeddingStore<>());
            records.put(collection, new LinkedHashMap<>());
            load(collection);
        }
    }

    @Override
    public synchronized void upsert(VectorCollection collection, List<VectorRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        InMemoryEmbeddingStore<TextSegment> store = stores.get(collection);
        Map<String, VectorRecord> mirror = records.get(collection);

        List<String> replaced = batch.stream().map(VectorRecord::id).filter(mirror::containsKey).toList();
        if (!replaced.isEmpty()) {
            store.removeAll(replaced);
        }
        addToStore(store, batch);
        batch.forEach(record -> mirror.put(record.id(), record));
        persist(collection);
    }

    @Override
    public synchronized List<VectorMatch> query(VectorCollection collection, Embedding queryVector, int maxResults, Filter filter) {
        if (records.get(collection).isEmpty() || maxResults <= 0) {
            return List.of();
        }
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryVector)
                .maxResults(maxResults)
                .minScore(0.0)
                .filter(filter)
                .build();

        List<VectorMatch> matches = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : stores.get(collection).search(request).matches()) {
            VectorRecord record = records.get(collection).get(match.embeddingId());
            if (record != null) {
                matches.add(new VectorMatch(record.id(), CosineSimilarity.fromRelevanceScore(match.score()),
                        record.text(), record.metadata()));
            }
        }
        return matches;
    }

    @Override
    public synchronized int removeWhere(VectorCollection collection, String metadataKey, Object value) {
        Map<String, VectorRecord> mirror = records.get(collection);
        List<String> ids = mirror.values().stream()
                .filter(record -> Objects.equals(record.metadata().get(metadataKey), value))
                .map(VectorRecord::id)
                .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        stores.get(collection).removeAll(ids);
        ids.forEach(mirror::remove);
        persist(collection);
        log.info("Removed {} records from {} where {}={}", ids.size(), collection.getStoreName(), metadataKey, value);
        return ids.size();
    }

    @Override
    public synchronized int count(VectorCollection collection) {
        return records.get(collection).size();
    }

    @Override
    public void ensureAvailable() {
        if (directory == null) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageUnavailableException(directory.toString(), e);
        }
        if (!Files.isWritable(directory)) {
            throw new StorageUnavailableException(directory.toString(), null);
        }
    }

    private void addToStore(InMemoryEmbeddingStore<TextSegment> store, List<VectorRecord> batch) {
        List<String> ids = new ArrayList<>();
        List<Embedding> embeddings = new ArrayList<>();
        List<TextSegment> segments = new ArrayList<>();
        for (VectorRecord record : batch) {
            ids.add(record.id());
            embeddings.add(Embedding.from(record.vector()));
            segments.add(TextSegment.from(record.text(), Metadata.from(record.metadata())));
        }
        store.addAll(ids, embeddings, segments);
    }

    private Path fileFor(VectorCollection collection) {
        return directory.resolve(collection.getStoreName() + ".json");
    }

    private void load(VectorCollection collection) {
        if (directory == null || !Files.exists(fileFor(collection))) {
            return;
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.VECTOR_STORE, "load:" + collection.getStoreName(), log);
        try {
            List<StoredRecord> stored = objectMapper.readValue(fileFor(collection).toFile(), RECORDS);
            List<VectorRecord> loaded = stored.stream().map(StoredRecord::toRecord).toList();
            if (!loaded.isEmpty()) {
                addToStore(stores.get(collection), loaded);
                loaded.forEach(record -> records.get(collection).put(record.id(), record));
            }
            ctx.logResponse("Loaded " + loaded.size() + " records");
        } catch (IOException e) {
            ctx.logError("Cannot read " + fileFor(collection), e);
            throw new StorageUnavailableException(fileFor(collection).toString(), e);
        }
    }

    private void persist(VectorCollection collection) {
        if (directory == null) {
            return;
        }
        Path target = fileFor(collection);
        try {
            Files.createDirectories(directory);
            Path temp = directory.resolve(collection.getStoreName() + ".json.tmp");
            List<StoredRecord> stored = records.get(collection).values().stream().map(StoredRecord::from).toList();
            objectMapper.writeValue(temp.toFile(), stored);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to persist {} collection to {}", collection.getStoreName(), target, e);
            throw new StorageUnavailableException(target.toString(), e);
        }
    }

    /**
     * On-disk form of a record.
     */
    record StoredRecord(String id, float[] vector, String text, Map<String, Object> metadata) {

        static StoredRecord from(VectorRecord record) {
            return new StoredRecord(record.id(), record.vector(), record.text(), record.metadata());
        }

        VectorRecord toRecord() {
            return new VectorRecord(id, vector, text, metadata == null ? Map.of() : metadata);
        }
    }
}
