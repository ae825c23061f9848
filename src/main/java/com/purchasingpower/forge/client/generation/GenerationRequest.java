package com.purchasingpower.forge.client.generation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class GenerationRequest {

    /**
     * Logical caller (router, executor, turn-summary, file-summary), used for logging.
     */
    String caller;

    String model;
    String systemInstruction;

    @Builder.Default
    List<GenerationMessage> messages = List.of();

    @Builder.Default
    List<ToolDefinition> tools = List.of();

    double temperature;
    int maxOutputTokens;
    Duration timeout;

    /**
     * Ask for an application/json response body.
     */
    boolean jsonOutput;
}
