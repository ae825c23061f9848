package com.purchasingpower.forge.chunking;

import com.purchasingpower.forge.model.chunk.LeafChunk;
import com.purchasingpower.forge.model.chunk.SectionSpan;
import com.purchasingpower.forge.util.TokenEstimator;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups consecutive leaves that share a top-level header under one parent.
 *
 * A group over the parent bound is cut into sub-parents at leaf boundaries.
 */
@Component
public class ParentChildBuilder {

    private static final String LEAF_SEPARATOR = "\n\n";

    public List<LeafChunk> build(List<SectionSpan> leaves, String sourceId, int parentMaxTokens) {
        List<LeafChunk> result = new ArrayList<>();
        for (List<SectionSpan> group : groupByTopHeader(leaves)) {
            for (List<SectionSpan> parent : splitToBound(group, parentMaxTokens)) {
                String parentText = joinText(parent);
                String parentId = parentId(sourceId, parentText);
                for (int leafIndex = 0; leafIndex < parent.size(); leafIndex++) {
                    SectionSpan leaf = parent.get(leafIndex);
                    result.add(LeafChunk.builder()
                            .sourceId(sourceId)
                            .chunkIndex(result.size())
                            .text(leaf.getText())
                            .headerPath(leaf.getHeaderPath())
                            .level(leaf.getLevel())
                            .contextHeader(leaf.getContextHeader())
                            .parentId(parentId)
                            .parentText(parentText)
                            .leafIndex(leafIndex)
                            .build());
                }
            }
        }
        return result;
    }

    static String parentId(String sourceId, String parentText) {
        return DigestUtils.md5DigestAsHex((sourceId + parentText).getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    private List<List<SectionSpan>> groupByTopHeader(List<SectionSpan> leaves) {
        List<List<SectionSpan>> groups = new ArrayList<>();
        List<SectionSpan> current = new ArrayList<>();
        for (SectionSpan leaf : leaves) {
            if (!current.isEmpty() && !current.get(0).topHeader().equals(leaf.topHeader())) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(leaf);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    private List<List<SectionSpan>> splitToBound(List<SectionSpan> group, int parentMaxTokens) {
        if (TokenEstimator.estimate(joinText(group)) <= parentMaxTokens) {
            return List.of(group);
        }
        List<List<SectionSpan>> parents = new ArrayList<>();
        List<SectionSpan> current = new ArrayList<>();
        int currentTokens = 0;
        for (SectionSpan leaf : group) {
            int tokens = TokenEstimator.estimate(leaf.getText());
            if (!current.isEmpty() && currentTokens + tokens > parentMaxTokens) {
                parents.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(leaf);
            currentTokens += tokens;
        }
        if (!current.isEmpty()) {
            parents.add(current);
        }
        return parents;
    }

    private static String joinText(List<SectionSpan> spans) {
        return String.join(LEAF_SEPARATOR, spans.stream().map(SectionSpan::getText).toList());
    }
}
