package com.purchasingpower.forge.chunking;

import com.purchasingpower.forge.configuration.AppProperties;
import com.purchasingpower.forge.configuration.ChunkingProperties;
import com.purchasingpower.forge.model.chunk.LeafChunk;
import com.purchasingpower.forge.model.chunk.SectionSpan;
import com.purchasingpower.forge.util.TokenEstimator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Full pipeline: raw document → markdown → header spans → sized leaves → leaf/parent pairs.
 *
 * <p>Deterministic for identical input and thresholds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkingPipeline {

    private final DocumentConverter converter;
    private final MarkdownSectionSplitter splitter;
    private final ChunkSizeEnforcer sizeEnforcer;
    private final ParentChildBuilder parentChildBuilder;
    private final AppProperties appProperties;

    /**
     * @throws com.purchasingpower.forge.exception.DocumentConversionException for this document only
     */
    public ChunkedDocument process(String sourceId, byte[] raw, DocumentFormat format) {
        String markdown = converter.convert(sourceId, raw, format);
        return new ChunkedDocument(markdown, chunkMarkdown(sourceId, markdown));
    }

    public List<LeafChunk> chunkMarkdown(String sourceId, String markdown) {
        ChunkingProperties sizes = appProperties.getChunking();

        List<SectionSpan> spans = splitter.split(markdown, sourceId);
        List<SectionSpan> leaves = sizeEnforcer.enforce(spans, sizes.getMinTokens(), sizes.getMaxTokens());
        List<LeafChunk> chunks = parentChildBuilder.build(leaves, sourceId, sizes.getParentMaxTokens());

        if (chunks.isEmpty()) {
            log.warn("No chunks produced from {}", sourceId);
        } else {
            int avgTokens = chunks.stream().mapToInt(c -> TokenEstimator.estimate(c.getText())).sum() / chunks.size();
            log.info("Chunked {}: {} leaf chunks, avg ~{} tokens each", sourceId, chunks.size(), avgTokens);
        }
        return chunks;
    }

    public record ChunkedDocument(String markdown, List<LeafChunk> chunks) {
    }
}
