package com.purchasingpower.forge.util;

/**
 * Cheap token estimate used for chunk sizing and prompt budgeting. Not a tokenizer.
 */
public final class TokenEstimator {

    private static final double TOKENS_PER_WORD = 1.3;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = text.trim().split("\\s+").length;
        return (int) (words * TOKENS_PER_WORD);
    }

    /**
     * Rough size of a rendered prompt, four characters per token.
     */
    public static int estimateFromChars(String text) {
        return text == null ? 0 : text.length() / 4;
    }
}
