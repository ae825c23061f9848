package com.purchasingpower.forge.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ChunkingProperties {

    @Min(1)
    private int minTokens = 100;

    @Min(1)
    private int maxTokens = 500;

    @Min(1)
    private int parentMaxTokens = 2000;
}
