package com.purchasingpower.forge.prompt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Prompt Library")
class PromptLibraryServiceTest {

    private PromptLibraryService library;

    @BeforeEach
    void setUp() {
        library = new PromptLibraryService();
        library.loadPrompts();
    }

    @Test
    @DisplayName("Should load every template with its caller")
    void testLoadPrompts() {
        assertThat(library.getTemplate("router").getCaller()).isEqualTo("router");
        assertThat(library.getTemplate("executor-gathering").getSystemPrompt()).isNotBlank();
        assertThat(library.getTemplate("executor-mode").getSystemPrompt()).isNotBlank();
        assertThat(library.getTemplate("file-summary").getUserPrompt()).contains("{{");
        assertThat(library.getTemplate("turn-summary").getMaxOutputTokens()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should render variables without HTML escaping")
    void testRenderUser_NoEscaping() {
        String rendered = library.renderUser("turn-summary", Map.of(
                "userMessage", "Is it <urgent> & \"late\"?",
                "assistantResponse", "Who's affected?"));

        assertThat(rendered).contains("User: Is it <urgent> & \"late\"?");
        assertThat(rendered).contains("Assistant: Who's affected?");
    }

    @Test
    @DisplayName("Should render missing variables as empty text")
    void testRenderUser_MissingVariable() {
        String rendered = library.renderUser("turn-summary", Map.of("userMessage", "hello"));

        assertThat(rendered).contains("User: hello");
        assertThat(rendered).contains("Assistant: \n").doesNotContain("{{");
    }

    @Test
    @DisplayName("Should reject an unknown template")
    void testGetTemplate_Unknown() {
        assertThatThrownBy(() -> library.getTemplate("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prompt template not found: nope");
    }
}
