package com.purchasingpower.forge.knowledge.impl;

import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("YAML Knowledge Index")
class YamlKnowledgeIndexTest {

    private YamlKnowledgeIndex index;

    @BeforeEach
    void setUp() {
        index = new YamlKnowledgeIndex();
        index.load();
    }

    @Test
    @DisplayName("Should resolve a probe by its exact key")
    void testLookup_ExactKey() {
        // When
        GuidanceUnit unit = index.lookup(GuidanceKind.PROBE, "Problem Clarity").orElseThrow();

        // Then
        assertThat(unit.mode()).isEqualTo(AnalysisMode.MODE_1);
        assertThat(unit.text()).startsWith("### Problem Clarity");
    }

    @Test
    @DisplayName("Should resolve keys regardless of case, quotes and a leading probe label")
    void testLookup_NormalisedKey() {
        assertThat(index.lookup(GuidanceKind.PROBE, "  problem   clarity ")).map(GuidanceUnit::key)
                .contains("Problem Clarity");
        assertThat(index.lookup(GuidanceKind.PROBE, "Probe 1: \"Problem Clarity\"")).map(GuidanceUnit::key)
                .contains("Problem Clarity");
        assertThat(index.lookup(GuidanceKind.PATTERN, "solution in disguise")).map(GuidanceUnit::key)
                .contains("Solution in Disguise");
    }

    @Test
    @DisplayName("Should return empty for unknown, blank or wrong-kind keys")
    void testLookup_Unknown() {
        assertThat(index.lookup(GuidanceKind.PROBE, "Nonexistent Probe")).isEmpty();
        assertThat(index.lookup(GuidanceKind.PROBE, " ")).isEmpty();
        assertThat(index.lookup(GuidanceKind.PROBE, null)).isEmpty();
        assertThat(index.lookup(GuidanceKind.PATTERN, "Problem Clarity")).isEmpty();
    }

    @Test
    @DisplayName("Should list keys per mode in catalogue order")
    void testKeys_ByMode() {
        // When
        List<String> mode1 = index.keys(GuidanceKind.PROBE, AnalysisMode.MODE_1);
        List<String> mode2 = index.keys(GuidanceKind.PROBE, AnalysisMode.MODE_2);
        List<String> all = index.keys(GuidanceKind.PROBE, null);

        // Then
        assertThat(mode1).first().isEqualTo("Problem Clarity");
        assertThat(mode2).contains("Value Risk").doesNotContain("Problem Clarity");
        assertThat(all).hasSize(mode1.size() + mode2.size());
    }
}
