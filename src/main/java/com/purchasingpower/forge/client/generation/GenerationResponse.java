package com.purchasingpower.forge.client.generation;

import java.util.List;
import java.util.stream.Collectors;

public record GenerationResponse(List<ContentBlock> blocks, String finishReason) {

    public String text() {
        return blocks.stream()
                .filter(ContentBlock.Text.class::isInstance)
                .map(block -> ((ContentBlock.Text) block).text())
                .collect(Collectors.joining());
    }

    public List<ContentBlock.ToolCall> toolCalls() {
        return blocks.stream()
                .filter(ContentBlock.ToolCall.class::isInstance)
                .map(ContentBlock.ToolCall.class::cast)
                .toList();
    }
}
