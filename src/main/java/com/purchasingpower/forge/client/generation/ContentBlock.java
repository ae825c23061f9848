package com.purchasingpower.forge.client.generation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One ordered piece of a message: plain text, a tool call from the model, or our answer to one.
 */
public interface ContentBlock {

    record Text(String text) implements ContentBlock {
    }

    /**
     * @param input tool arguments as returned by the model, never null
     */
    record ToolCall(String id, String name, JsonNode input) implements ContentBlock {
    }

    record ToolResult(String callId, String name, String content, boolean error) implements ContentBlock {
    }
}
