package com.purchasingpower.forge.prompt;

import com.purchasingpower.forge.factstore.FactStore;
import com.purchasingpower.forge.model.assumption.AssumptionCategory;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import com.purchasingpower.forge.model.assumption.Confidence;
import com.purchasingpower.forge.model.assumption.Impact;
import com.purchasingpower.forge.model.assumption.NewAssumption;
import com.purchasingpower.forge.model.conversation.ChatMessage;
import com.purchasingpower.forge.model.conversation.FileSummary;
import com.purchasingpower.forge.model.conversation.OrgContext;
import com.purchasingpower.forge.model.skeleton.StakeholderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Prompt Context Formatter")
class PromptContextFormatterTest {

    private final PromptContextFormatter formatter = new PromptContextFormatter();

    private static FactStore storeWithAssumptions() {
        FactStore store = new FactStore(8);
        store.registerAssumption(NewAssumption.builder()
                .claim("Managers act on alerts")
                .category(AssumptionCategory.VALUE)
                .impact(Impact.HIGH)
                .confidence(Confidence.GUESSED)
                .basis("stated by user")
                .build(), 1);
        store.registerAssumption(NewAssumption.builder()
                .claim("Carrier data is reliable")
                .category(AssumptionCategory.TECHNICAL)
                .impact(Impact.MEDIUM)
                .confidence(Confidence.INFORMED)
                .basis("vendor docs")
                .build(), 1);
        return store;
    }

    @Test
    @DisplayName("Should flag unaddressed high-impact guesses in the router summary")
    void testAssumptionSummary() {
        FactStore store = storeWithAssumptions();

        String summary = formatter.assumptionSummary(store.all());

        assertThat(summary.lines()).containsExactly(
                "[!] A1: [high/guessed/active] Managers act on alerts",
                "A2: [medium/informed/active] Carrier data is reliable");

        store.updateStatus("A1", AssumptionStatus.INVALIDATED, "disproved", 2);
        assertThat(formatter.assumptionSummary(store.all())).doesNotContain("[!]");
    }

    @Test
    @DisplayName("Should use placeholders for empty state")
    void testEmptyState() {
        FactStore store = new FactStore(8);

        assertThat(formatter.assumptionSummary(List.of())).isEqualTo(PromptContextFormatter.NO_ASSUMPTIONS);
        assertThat(formatter.assumptionRegister(List.of())).isEqualTo(PromptContextFormatter.NO_ASSUMPTIONS);
        assertThat(formatter.skeleton(store.getSkeleton())).isEqualTo(PromptContextFormatter.EMPTY_SKELETON);
        assertThat(formatter.projectContext(new OrgContext(), List.of())).isEqualTo(PromptContextFormatter.NO_CONTEXT);
        assertThat(formatter.recentMessages(List.of())).isEqualTo("(no previous messages)");
        assertThat(formatter.firings(List.of())).isEqualTo("none");
    }

    @Test
    @DisplayName("Should list skeleton fields that are set")
    void testSkeleton() {
        FactStore store = new FactStore(8);
        store.setProblemStatement("Stores learn about delays too late");
        store.addStakeholder("VP Stores", StakeholderType.DECISION_AUTHORITY, true, "owns budget");

        String text = formatter.skeleton(store.getSkeleton());

        assertThat(text).isEqualTo("Problem: Stores learn about delays too late\n"
                + "Stakeholders:\n  - S1 VP Stores (decision_authority) [validated]");
    }

    @Test
    @DisplayName("Should include org context and documents")
    void testProjectContext() {
        OrgContext org = new OrgContext();
        org.setCompany("FreshMart");
        org.setPublicContext("Regional grocery chain.");

        String text = formatter.projectContext(org, List.of(new FileSummary("interviews.md", "Manager interviews", 4)));

        assertThat(text).isEqualTo("## Organization Context\nFreshMart\nRegional grocery chain.\n\n"
                + "## Available Documents\n- **interviews.md**: Manager interviews");
    }

    @Test
    @DisplayName("Should fence long user messages only")
    void testMessages_FencesLongInput() {
        String pasted = "x".repeat(600);

        String text = formatter.messages(List.of(ChatMessage.user("short"), ChatMessage.user(pasted),
                ChatMessage.assistant("y".repeat(600))));

        assertThat(text).startsWith("**USER:** short\n\n**USER:** <user_context>\n" + pasted + "\n</user_context>");
        assertThat(text).endsWith("**ASSISTANT:** " + "y".repeat(600));
    }
}
