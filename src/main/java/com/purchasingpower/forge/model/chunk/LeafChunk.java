package com.purchasingpower.forge.model.chunk;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A retrievable leaf with the parent section it expands to.
 *
 * <p>Leaves are embedded; the parent text is what the executor reads.
 */
@Value
@Builder
public class LeafChunk {
    String sourceId;
    int chunkIndex;
    String text;
    List<String> headerPath;
    int level;
    String contextHeader;
    String parentId;
    String parentText;
    int leafIndex;

    public String id() {
        return sourceId + "_chunk_" + chunkIndex;
    }
}
