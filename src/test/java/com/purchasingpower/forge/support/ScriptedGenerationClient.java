package com.purchasingpower.forge.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.generation.ContentBlock;
import com.purchasingpower.forge.client.generation.GenerationClient;
import com.purchasingpower.forge.client.generation.GenerationRequest;
import com.purchasingpower.forge.client.generation.GenerationResponse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued responses (or failures) in order and records every request.
 */
public class ScriptedGenerationClient implements GenerationClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<GenerationRequest> requests = new ArrayList<>();

    public ScriptedGenerationClient then(ContentBlock... blocks) {
        script.add(new GenerationResponse(List.of(blocks), "STOP"));
        return this;
    }

    public ScriptedGenerationClient thenFail(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    @Override
    public synchronized GenerationResponse generate(GenerationRequest request) {
        requests.add(request);
        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted response left for call " + requests.size());
        }
        if (next instanceof RuntimeException failure) {
            throw failure;
        }
        return (GenerationResponse) next;
    }

    public List<GenerationRequest> getRequests() {
        return requests;
    }

    public static ContentBlock text(String text) {
        return new ContentBlock.Text(text);
    }

    public static ContentBlock toolCall(String name, String jsonArguments) {
        try {
            return new ContentBlock.ToolCall("call-" + name, name, MAPPER.readTree(jsonArguments));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad test arguments: " + jsonArguments, e);
        }
    }
}
