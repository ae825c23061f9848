package com.purchasingpower.forge.model.chunk;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A span of markdown between two headers, or a piece of one after size enforcement.
 *
 * <p>{@code level} is 0 for text before the first header, 1 to 3 for H1 to H3.
 */
@Value
@Builder(toBuilder = true)
public class SectionSpan {
    String text;
    List<String> headerPath;
    int level;
    String contextHeader;

    public String topHeader() {
        return headerPath.isEmpty() ? "" : headerPath.get(0);
    }
}
