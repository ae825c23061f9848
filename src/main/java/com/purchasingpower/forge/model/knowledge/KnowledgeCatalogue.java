package com.purchasingpower.forge.model.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code knowledge/*.yaml} file.
 *
 * <pre>
 * mode: mode_2
 * probes:
 *   - key: Value Risk
 *     text: |
 *       ...
 * patterns:
 *   - key: Data Optimism
 *     text: |
 *       ...
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnowledgeCatalogue {

    private AnalysisMode mode;
    private List<Entry> probes = new ArrayList<>();
    private List<Entry> patterns = new ArrayList<>();

    @Data
    public static class Entry {
        private String key;
        private String text;
    }
}
