package com.purchasingpower.forge.routing;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Recognises acknowledgement turns ("yes, continue", "ok thanks") that carry no new content.
 *
 * Consulted only when the router leaves out {@code requires_retrieval}.
 */
@Component
public class FillerMessageDetector {

    private static final int MAX_FILLER_WORDS = 6;

    private static final Set<String> FILLER_WORDS = Set.of(
            "yes", "yeah", "yep", "yup", "no", "nope", "ok", "okay", "k", "sure", "continue", "go", "on",
            "ahead", "thanks", "thank", "you", "got", "it", "sounds", "good", "great", "makes", "sense",
            "right", "correct", "agreed", "agree", "next", "proceed", "please", "lets", "let's", "do",
            "that", "perfect", "fine", "cool", "alright", "exactly", "keep", "going");

    public boolean isFiller(String message) {
        if (message == null || message.isBlank()) {
            return true;
        }
        if (message.contains("?")) {
            return false;
        }
        String[] words = message.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z' ]", " ")
                .trim()
                .split("\\s+");
        if (words.length > MAX_FILLER_WORDS) {
            return false;
        }
        for (String word : words) {
            if (!word.isEmpty() && !FILLER_WORDS.contains(word)) {
                return false;
            }
        }
        return true;
    }
}
