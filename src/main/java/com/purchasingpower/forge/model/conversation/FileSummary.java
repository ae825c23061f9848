package com.purchasingpower.forge.model.conversation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileSummary {
    private String sourceId;
    private String summary;
    private int chunkCount;
}
