package com.purchasingpower.forge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the Google Gemini generation and embedding endpoints.
 *
 * <p>Properties are loaded from the {@code app.gemini} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   gemini:
 *     api-key: ${GEMINI_KEY}
 *     chat-model: gemini-2.5-pro
 *     router-model: gemini-2.5-flash
 *     summary-model: gemini-2.5-flash-lite
 *     embedding-model: gemini-embedding-001
 *     embedding-dimensions: 1024
 *     caller-temperatures:
 *       router: 0.0
 *     retry:
 *       max-attempts: 5
 *       initial-backoff: 2s
 *       max-backoff: 60s
 * </pre>
 *
 * <p>Each caller (router, executor, turn-summary, document-summary) picks its own model,
 * temperature and timeout so the router can stay small and fast while the executor gets
 * the larger model.
 */
@ConfigurationProperties(prefix = "app.gemini")
@Data
public class GeminiConfig {

    public static final String CALLER_ROUTER = "router";
    public static final String CALLER_EXECUTOR = "executor";
    public static final String CALLER_TURN_SUMMARY = "turn-summary";
    public static final String CALLER_FILE_SUMMARY = "file-summary";

    /**
     * API key for Google Gemini service. Should be set via environment variable GEMINI_KEY.
     */
    private String apiKey;

    private String baseUrl = "https://generativelanguage.googleapis.com";

    private String apiVersion = "v1beta";

    /**
     * Model used by the turn executor (heavy, tool-calling).
     */
    private String chatModel = "gemini-2.5-pro";

    /**
     * Model used by the turn router. Should be an order of magnitude cheaper than the chat model.
     */
    private String routerModel = "gemini-2.5-flash";

    /**
     * Model used for turn summaries and uploaded file summaries.
     */
    private String summaryModel = "gemini-2.5-flash-lite";

    private String embeddingModel = "gemini-embedding-001";

    /**
     * Output dimensionality requested from the embedding model.
     */
    private int embeddingDimensions = 1024;

    /**
     * Default temperature for Gemini API calls.
     */
    private double defaultTemperature = 0.7;

    /**
     * Caller-specific temperature overrides. If a caller is not in this map, defaultTemperature is used.
     */
    private Map<String, Double> callerTemperatures;

    private Timeouts timeouts = new Timeouts();

    private EmbeddingBatch embedding = new EmbeddingBatch();

    /**
     * Retry configuration for transient Gemini API failures.
     */
    private RetryConfig retry = new RetryConfig();

    /**
     * Get the temperature setting for a specific caller.
     *
     * @param caller the caller name (e.g., "router", "executor")
     * @return the temperature for this caller, or defaultTemperature if not configured
     */
    public double getTemperatureFor(String caller) {
        if (callerTemperatures == null) {
            return defaultTemperature;
        }
        return callerTemperatures.getOrDefault(caller, defaultTemperature);
    }

    /**
     * Model for a caller: the router and executor have their own, every summary caller shares one.
     */
    public String getModelFor(String caller) {
        return switch (caller) {
            case CALLER_ROUTER -> routerModel;
            case CALLER_EXECUTOR -> chatModel;
            default -> summaryModel;
        };
    }

    public Duration getTimeoutFor(String caller) {
        return switch (caller) {
            case CALLER_ROUTER -> timeouts.getRouter();
            case CALLER_EXECUTOR -> timeouts.getExecutor();
            default -> timeouts.getSummary();
        };
    }

    @Data
    public static class Timeouts {
        private Duration router = Duration.ofSeconds(30);
        private Duration executor = Duration.ofSeconds(120);
        private Duration summary = Duration.ofSeconds(20);
        private Duration embedding = Duration.ofSeconds(30);
    }

    @Data
    public static class EmbeddingBatch {

        /**
         * Texts per batchEmbedContents request. Gemini accepts at most 100.
         */
        private int batchSize = 100;

        /**
         * Batches dispatched concurrently for one ingestion.
         */
        private int maxInFlight = 4;
    }

    /**
     * Retry configuration for Gemini API calls.
     *
     * <p>Defines exponential backoff behavior for transient failures like rate limits
     * and temporary server errors.
     */
    @Data
    public static class RetryConfig {

        /**
         * Maximum number of retry attempts for failed API calls.
         */
        private int maxAttempts = 5;

        private Duration initialBackoff = Duration.ofSeconds(2);

        /**
         * Maximum backoff delay between retries.
         */
        private Duration maxBackoff = Duration.ofSeconds(60);

        /**
         * HTTP status codes that should trigger a retry.
         * Common values: 429 (rate limit), 500, 502, 503, 504 (server errors)
         */
        private List<Integer> retryableStatusCodes;
    }
}
