package com.purchasingpower.forge.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.purchasingpower.forge.knowledge.KnowledgeIndex;
import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.knowledge.KnowledgeCatalogue;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Loads {@code classpath:knowledge/*.yaml} once at start-up.
 *
 * Two catalogues defining the same key (after normalisation) fail start-up.
 */
@Slf4j
@Component
public class YamlKnowledgeIndex implements KnowledgeIndex {

    private static final Pattern LEADING_LABEL = Pattern.compile("^(probe|pattern)\\s*\\d+\\s*[:.\\-]\\s*");
    private static final Pattern QUOTES = Pattern.compile("[\"'“”‘’]");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final String locationPattern;
    private final Map<GuidanceKind, Map<String, GuidanceUnit>> units = new EnumMap<>(GuidanceKind.class);

    public YamlKnowledgeIndex() {
        this("classpath:knowledge/*.yaml");
    }

    YamlKnowledgeIndex(String locationPattern) {
        this.locationPattern = locationPattern;
        for (GuidanceKind kind : GuidanceKind.values()) {
            units.put(kind, new LinkedHashMap<>());
        }
    }

    @PostConstruct
    public void load() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(locationPattern);
            for (Resource resource : resources) {
                KnowledgeCatalogue catalogue = yamlMapper.readValue(resource.getInputStream(), KnowledgeCatalogue.class);
                register(GuidanceKind.PROBE, catalogue.getMode(), catalogue.getProbes(), resource);
                register(GuidanceKind.PATTERN, catalogue.getMode(), catalogue.getPatterns(), resource);
                log.info("Loaded knowledge catalogue {} ({} probes, {} patterns)",
                        resource.getFilename(), catalogue.getProbes().size(), catalogue.getPatterns().size());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Knowledge index initialization failed", e);
        }
    }

    private void register(GuidanceKind kind, AnalysisMode mode, List<KnowledgeCatalogue.Entry> entries, Resource source) {
        Map<String, GuidanceUnit> byKey = units.get(kind);
        for (KnowledgeCatalogue.Entry entry : entries) {
            String normalized = normalize(entry.getKey());
            if (byKey.containsKey(normalized)) {
                throw new IllegalStateException("Duplicate " + kind.name().toLowerCase(Locale.ROOT)
                        + " key '" + entry.getKey() + "' in " + source.getFilename());
            }
            byKey.put(normalized, new GuidanceUnit(kind, entry.getKey().trim(), mode, entry.getText().strip()));
        }
    }

    @Override
    public Optional<GuidanceUnit> lookup(GuidanceKind kind, String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        GuidanceUnit unit = units.get(kind).get(normalize(key));
        if (unit == null) {
            log.debug("No {} found for key '{}'", kind, key);
        }
        return Optional.ofNullable(unit);
    }

    @Override
    public List<String> keys(GuidanceKind kind, AnalysisMode mode) {
        return units.get(kind).values().stream()
                .filter(unit -> mode == null || unit.mode() == mode)
                .map(GuidanceUnit::key)
                .toList();
    }

    static String normalize(String key) {
        String value = QUOTES.matcher(key.trim()).replaceAll("");
        value = value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return LEADING_LABEL.matcher(value).replaceFirst("");
    }
}
