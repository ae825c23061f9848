package com.purchasingpower.forge.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ConversationProperties {

    @Min(1)
    private int maxToolIterations = 10;

    @Min(1)
    private int cascadeDepth = 8;

    @Min(1)
    private int microSynthesisInterval = 3;

    @Min(0)
    private int maxEnrichments = 3;

    /**
     * Messages kept (besides the first) when the executor prompt has to be truncated.
     */
    @Min(2)
    private int historyKeepRecent = 20;

    /**
     * Estimated prompt size (chars / 4) above which history is truncated.
     */
    @Min(1000)
    private int promptTokenLimit = 150_000;

    @Min(100)
    private int routerMaxOutputTokens = 500;

    @Min(100)
    private int executorMaxOutputTokens = 8192;

    /**
     * Write snapshot.json after every turn and restore unknown conversations from disk.
     */
    private boolean persistSnapshots = true;
}
