package com.purchasingpower.forge.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: router
 * version: 1.0
 * caller: router
 * maxOutputTokens: 500
 * systemPrompt: |
 *   You decide what the assistant does next...
 * userPrompt: |
 *   {{{userMessage}}}
 * </pre>
 *
 * {@code caller} selects the model, temperature and timeout from
 * {@link com.purchasingpower.forge.config.GeminiConfig}.
 *
 * @see com.purchasingpower.forge.prompt.PromptLibraryService
 */
@JsonIgnoreProperties(ignoreUnknown = true)  // Allow extra fields like "notes" for documentation
public class PromptTemplate {
    private String name;
    private String version;
    private String caller;
    private int maxOutputTokens;
    private String systemPrompt;
    private String userPrompt;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getCaller() {
        return caller;
    }

    public void setCaller(String caller) {
        this.caller = caller;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public void setUserPrompt(String userPrompt) {
        this.userPrompt = userPrompt;
    }
}
