package com.llestrade.core.llm;

/**
 * Character based token estimate (about four characters per token) used when a provider offers
 * no local tokenizer.
 */
public final class TokenEstimates {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimates() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
