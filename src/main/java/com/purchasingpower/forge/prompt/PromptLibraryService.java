package com.purchasingpower.forge.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.forge.model.prompt.PromptTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files and renders the system and user halves separately,
 * since the generation boundary takes a system instruction apart from the messages.
 *
 * Usage:
 * String system = promptLibrary.renderSystem("router", Map.of(
 *     "assumptionSummary", summary,
 *     "probeKeys", keys
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new PlainTextMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:prompts/*.yaml");

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(
                        resource.getInputStream(),
                        PromptTemplate.class
                );

                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})",
                        template.getName(), template.getVersion());
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (Exception e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    public String renderSystem(String templateName, Map<String, Object> variables) {
        return render(templateName + "#system", getTemplate(templateName).getSystemPrompt(), variables);
    }

    public String renderUser(String templateName, Map<String, Object> variables) {
        return render(templateName + "#user", getTemplate(templateName).getUserPrompt(), variables);
    }

    /**
     * Get template metadata
     *
     * @throws IllegalArgumentException if no template has this name
     */
    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }

    private String render(String cacheKey, String text, Map<String, Object> variables) {
        if (text == null) {
            return "";
        }
        Mustache mustache = compiled.computeIfAbsent(cacheKey,
                key -> mustacheFactory.compile(new StringReader(text), key));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }
}
