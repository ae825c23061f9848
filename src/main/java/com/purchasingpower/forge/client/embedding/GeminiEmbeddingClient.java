package com.purchasingpower.forge.client.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.forge.config.GeminiConfig;
import com.purchasingpower.forge.exception.EmbeddingException;
import com.purchasingpower.forge.exception.EmbeddingRateLimitException;
import com.purchasingpower.forge.model.CallContext;
import com.purchasingpower.forge.model.ServiceType;
import com.purchasingpower.forge.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Gemini {@code batchEmbedContents}.
 *
 * <p>Texts are sent in batches of at most {@code embedding.batchSize}; up to
 * {@code embedding.maxInFlight} batches run concurrently and results keep input order.
 * Each batch is retried on 429, 5xx, timeouts and transport errors with exponential backoff;
 * any other 4xx fails immediately.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiEmbeddingClient implements EmbeddingClient {

    private static final String TASK_DOCUMENT = "RETRIEVAL_DOCUMENT";
    private static final String TASK_QUERY = "RETRIEVAL_QUERY";

    private final WebClient geminiWebClient;
    private final GeminiConfig geminiConfig;
    private final ObjectMapper objectMapper;

    @Override
    public List<Embedding> embedDocuments(List<String> texts) {
        return embed(texts, TASK_DOCUMENT);
    }

    @Override
    public Embedding embedQuery(String text) {
        return embed(List.of(text), TASK_QUERY).get(0);
    }

    private List<Embedding> embed(List<String> texts, String taskType) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        GeminiConfig.EmbeddingBatch batching = geminiConfig.getEmbedding();
        List<List<String>> batches = new ArrayList<>();
        for (int i = 0; i < texts.size(); i += batching.getBatchSize()) {
            batches.add(texts.subList(i, Math.min(i + batching.getBatchSize(), texts.size())));
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GEMINI, "batchEmbedContents", log);
        ctx.logRequest("Embedding " + texts.size() + " texts",
                "Task", taskType, "Batches", batches.size(), "Model", geminiConfig.getEmbeddingModel());
        try {
            List<Embedding> embeddings = Flux.fromIterable(batches)
                    .flatMapSequential(batch -> callBatch(batch, taskType), batching.getMaxInFlight())
                    .flatMapIterable(list -> list)
                    .collectList()
                    .block();

            if (embeddings == null || embeddings.size() != texts.size()) {
                throw new EmbeddingException("Expected " + texts.size() + " embeddings, got "
                        + (embeddings == null ? 0 : embeddings.size()), 0, false);
            }
            ctx.logResponse("Embedded " + embeddings.size() + " texts");
            return embeddings;
        } catch (EmbeddingException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            ctx.logError("Embedding failed", e);
            throw new EmbeddingException("Embedding failed: " + e.getMessage(), e);
        }
    }

    private Mono<List<Embedding>> callBatch(List<String> batch, String taskType) {
        String model = geminiConfig.getEmbeddingModel();
        String url = String.format("/%s/models/%s:batchEmbedContents", geminiConfig.getApiVersion(), model);

        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode requests = body.putArray("requests");
        for (String text : batch) {
            ObjectNode request = requests.addObject();
            request.put("model", "models/" + model);
            request.putObject("content").putArray("parts").addObject().put("text", text);
            request.put("taskType", taskType);
            request.put("outputDimensionality", geminiConfig.getEmbeddingDimensions());
        }

        GeminiConfig.RetryConfig retry = geminiConfig.getRetry();
        return geminiWebClient.post()
                .uri(url)
                .bodyValue(body)
                .retrieve()
                .onStatus(status -> status.value() == 429, response -> toException(response, true))
                .onStatus(HttpStatusCode::isError, response -> toException(response, false))
                .bodyToMono(JsonNode.class)
                .timeout(geminiConfig.getTimeouts().getEmbedding())
                .map(this::parseEmbeddings)
                .retryWhen(Retry.backoff(retry.getMaxAttempts(), retry.getInitialBackoff())
                        .maxBackoff(retry.getMaxBackoff())
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying embedding batch (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Mono<? extends Throwable> toException(ClientResponse response, boolean rateLimited) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(bodyText -> {
                    String message = "Embedding request failed with " + status + ": "
                            + ExternalCallLogger.truncate(bodyText, 200);
                    if (rateLimited) {
                        return new EmbeddingRateLimitException(message);
                    }
                    return new EmbeddingException(message, status, response.statusCode().is5xxServerError());
                });
    }

    private List<Embedding> parseEmbeddings(JsonNode response) {
        List<Embedding> embeddings = new ArrayList<>();
        for (JsonNode node : response.path("embeddings")) {
            JsonNode values = node.path("values");
            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = (float) values.get(i).asDouble();
            }
            embeddings.add(Embedding.from(vector));
        }
        return embeddings;
    }

    private boolean isRetryable(Throwable ex) {
        if (ex instanceof EmbeddingException embeddingEx) {
            return embeddingEx.isRetryable();
        }
        return ex instanceof TimeoutException || ex instanceof WebClientRequestException;
    }
}
