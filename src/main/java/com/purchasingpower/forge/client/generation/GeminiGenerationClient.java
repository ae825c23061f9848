package com.purchasingpower.forge.client.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.exception.GenerationException;
import com.purchasingpower.forge.model.CallContext;
import com.purchasingpower.forge.model.ServiceType;
import com.purchasingpower.forge.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;

/**
 * Gemini {@code generateContent} over WebClient.
 *
 * <p>Transient HTTP failures are retried with exponential backoff; the configured timeout bounds
 * the whole call including retries. Every failure surfaces as {@link GenerationException} so the
 * caller can degrade.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiGenerationClient implements GenerationClient {

    private final WebClient geminiWebClient;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        ctx.logRequest("Generating for " + request.getCaller(),
                "Model", request.getModel(),
                "Messages", request.getMessages().size(),
                "Tools", request.getTools().size(),
                "System", ExternalCallLogger.truncate(request.getSystemInstruction(), 300));

        String url = String.format("/%s/models/%s:generateContent", geminiConfig.getApiVersion(), request.getModel());
        try {
            JsonNode response = geminiWebClient.post()
                    .uri(url)
                    .bodyValue(buildBody(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(buildRetrySpec())
                    .timeout(request.getTimeout())
                    .block();

            GenerationResponse parsed = parseResponse(response);
            ctx.logResponse(ExternalCallLogger.truncate(parsed.text(), 300),
                    "Finish", parsed.finishReason(),
                    "Tool calls", parsed.toolCalls().size());
            return parsed;
        } catch (RuntimeException e) {
            ctx.logError("Generation failed for " + request.getCaller(), e);
            throw new GenerationException(request.getModel(), "Generation failed: " + e.getMessage(), e);
        }
    }

    ObjectNode buildBody(GenerationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();

        if (request.getSystemInstruction() != null && !request.getSystemInstruction().isBlank()) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", request.getSystemInstruction());
        }

        ArrayNode contents = body.putArray("contents");
        for (GenerationMessage message : request.getMessages()) {
            ObjectNode content = contents.addObject();
            content.put("role", message.role() == GenerationMessage.Role.MODEL ? "model" : "user");
            ArrayNode parts = content.putArray("parts");
            for (ContentBlock block : message.blocks()) {
                if (block instanceof ContentBlock.Text text) {
                    parts.addObject().put("text", text.text());
                } else if (block instanceof ContentBlock.ToolCall call) {
                    ObjectNode functionCall = parts.addObject().putObject("functionCall");
                    functionCall.put("name", call.name());
                    functionCall.set("args", call.input());
                } else if (block instanceof ContentBlock.ToolResult result) {
                    ObjectNode functionResponse = parts.addObject().putObject("functionResponse");
                    functionResponse.put("name", result.name());
                    ObjectNode payload = functionResponse.putObject("response");
                    payload.put(result.error() ? "error" : "content", result.content());
                }
            }
        }

        if (!request.getTools().isEmpty()) {
            ArrayNode declarations = body.putArray("tools").addObject().putArray("functionDeclarations");
            for (ToolDefinition tool : request.getTools()) {
                ObjectNode declaration = declarations.addObject();
                declaration.put("name", tool.name());
                declaration.put("description", tool.description());
                declaration.set("parameters", tool.parameters());
            }
        }

        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("temperature", request.getTemperature());
        if (request.getMaxOutputTokens() > 0) {
            generationConfig.put("maxOutputTokens", request.getMaxOutputTokens());
        }
        if (request.isJsonOutput()) {
            generationConfig.put("responseMimeType", "application/json");
        }
        return body;
    }

    GenerationResponse parseResponse(JsonNode root) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (root == null) {
            return new GenerationResponse(blocks, "EMPTY");
        }
        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("NO_CANDIDATES");
            log.warn("Gemini returned no candidates: {}", blockReason);
            return new GenerationResponse(blocks, blockReason);
        }

        int callIndex = 0;
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("thought").asBoolean(false)) {
                continue;
            }
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                JsonNode args = call.has("args") ? call.get("args") : objectMapper.createObjectNode();
                String id = call.path("id").asText("call_" + callIndex);
                blocks.add(new ContentBlock.ToolCall(id, call.path("name").asText(), args));
                callIndex++;
            } else if (part.has("text")) {
                blocks.add(new ContentBlock.Text(part.get("text").asText()));
            }
        }
        return new GenerationResponse(blocks, candidate.path("finishReason").asText("UNKNOWN"));
    }

    private Retry buildRetrySpec() {
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), retry.getInitialBackoff())
                .maxBackoff(retry.getMaxBackoff())
                .filter(this::isRetryable);
    }

    /**
     * Configured status codes, or 429 and any 5xx when none are configured.
     */
    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        if (retry.getRetryableStatusCodes() == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return retry.getRetryableStatusCodes().contains(webEx.getStatusCode().value());
    }
}
