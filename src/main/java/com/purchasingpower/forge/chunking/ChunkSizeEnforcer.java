package com.purchasingpower.forge.chunking;

import com.purchasingpower.forge.model.chunk.SectionSpan;
import com.purchasingpower.forge.util.TokenEstimator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Brings section spans within the leaf size bounds.
 *
 * <p>Oversized spans are split at paragraph breaks, then at sentence ends, and grouped greedily;
 * a single sentence larger than the bound is kept whole. Undersized spans are merged into the
 * following spans at the same level under the same top-level header, then into the preceding one,
 * as long as the result stays within the upper bound. Spans are never merged across top-level
 * headers so every leaf keeps a single parent.
 */
@Component
public class ChunkSizeEnforcer {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public List<SectionSpan> enforce(List<SectionSpan> spans, int minTokens, int maxTokens) {
        List<SectionSpan> sized = new ArrayList<>();
        for (SectionSpan span : spans) {
            if (TokenEstimator.estimate(span.getText()) > maxTokens) {
                sized.addAll(splitLarge(span, maxTokens));
            } else {
                sized.add(span);
            }
        }
        return mergeSmall(sized, minTokens, maxTokens);
    }

    private List<SectionSpan> splitLarge(SectionSpan span, int maxTokens) {
        List<String> pieces = new ArrayList<>();
        for (String group : group(Arrays.asList(PARAGRAPH_BREAK.split(span.getText())), maxTokens, "\n\n")) {
            if (TokenEstimator.estimate(group) > maxTokens) {
                pieces.addAll(group(Arrays.asList(SENTENCE_END.split(group)), maxTokens, " "));
            } else {
                pieces.add(group);
            }
        }

        List<SectionSpan> result = new ArrayList<>();
        for (int i = 0; i < pieces.size(); i++) {
            String suffix = pieces.size() > 1 ? " (part " + (i + 1) + ")" : "";
            result.add(span.toBuilder()
                    .text(pieces.get(i).strip())
                    .contextHeader(span.getContextHeader() + suffix)
                    .build());
        }
        return result;
    }

    private List<String> group(List<String> segments, int maxTokens, String separator) {
        List<String> groups = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String segment : segments) {
            if (segment.isBlank()) {
                continue;
            }
            if (!current.isEmpty()) {
                String candidate = String.join(separator, current) + separator + segment;
                if (TokenEstimator.estimate(candidate) > maxTokens) {
                    groups.add(String.join(separator, current));
                    current.clear();
                }
            }
            current.add(segment);
        }
        if (!current.isEmpty()) {
            groups.add(String.join(separator, current));
        }
        return groups;
    }

    private List<SectionSpan> mergeSmall(List<SectionSpan> sized, int minTokens, int maxTokens) {
        List<SectionSpan> merged = new ArrayList<>();
        int i = 0;
        while (i < sized.size()) {
            SectionSpan current = sized.get(i++);
            while (isUndersized(current, minTokens) && i < sized.size()
                    && canMerge(current, sized.get(i), maxTokens)) {
                current = join(current, sized.get(i++));
            }
            if (isUndersized(current, minTokens) && !merged.isEmpty()) {
                SectionSpan previous = merged.get(merged.size() - 1);
                if (canMerge(previous, current, maxTokens)) {
                    merged.set(merged.size() - 1, join(previous, current));
                    continue;
                }
            }
            merged.add(current);
        }
        return merged;
    }

    private static boolean isUndersized(SectionSpan span, int minTokens) {
        return TokenEstimator.estimate(span.getText()) < minTokens;
    }

    private static boolean canMerge(SectionSpan first, SectionSpan second, int maxTokens) {
        return first.getLevel() == second.getLevel()
                && first.topHeader().equals(second.topHeader())
                && TokenEstimator.estimate(first.getText() + "\n\n" + second.getText()) <= maxTokens;
    }

    private static SectionSpan join(SectionSpan first, SectionSpan second) {
        return first.toBuilder().text(first.getText() + "\n\n" + second.getText()).build();
    }
}
