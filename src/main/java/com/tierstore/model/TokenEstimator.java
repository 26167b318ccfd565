package com.tierstore.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Approximates model tokens as one per whitespace-separated word, plus one per additional four
 * characters of long words.
 */
public final class TokenEstimator {
    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int tokens = 0;
        for (String word : text.strip().split("\\s+")) {
            tokens += wordTokens(word);
        }
        return tokens;
    }

    /** Cuts {@code text} at a word boundary so that it estimates to at most {@code maxTokens}. */
    public static String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || estimate(text) <= maxTokens) {
            return text == null ? "" : text.strip();
        }
        StringBuilder out = new StringBuilder();
        int used = 0;
        int index = 0;
        String stripped = text.strip();
        while (index < stripped.length()) {
            int wordStart = index;
            while (index < stripped.length() && !Character.isWhitespace(stripped.charAt(index))) {
                index++;
            }
            String word = stripped.substring(wordStart, index);
            int cost = wordTokens(word);
            if (used + cost > maxTokens) {
                break;
            }
            used += cost;
            out.append(word);
            int gapStart = index;
            while (index < stripped.length() && Character.isWhitespace(stripped.charAt(index))) {
                index++;
            }
            out.append(stripped, gapStart, index);
        }
        return out.toString().strip();
    }

    /**
     * Cuts {@code text} into consecutive pieces that each estimate to at most {@code maxTokens}.
     * Cuts fall on word boundaries; a single word longer than the budget is cut every
     * {@code 4 * maxTokens} characters. The pieces concatenate back to {@code text}.
     */
    public static List<String> split(String text, int maxTokens) {
        List<String> pieces = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return pieces;
        }
        int budget = Math.max(1, maxTokens);
        int maxWordChars = budget * 4;
        StringBuilder current = new StringBuilder();
        int used = 0;
        int index = 0;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        current.append(text, 0, index);
        while (index < text.length()) {
            int wordStart = index;
            while (index < text.length() && !Character.isWhitespace(text.charAt(index))) {
                index++;
            }
            int wordEnd = index;
            while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
                index++;
            }
            for (int start = wordStart; start < wordEnd; start += maxWordChars) {
                int end = Math.min(wordEnd, start + maxWordChars);
                int cost = wordTokens(end - start);
                if (used > 0 && used + cost > budget) {
                    pieces.add(current.toString());
                    current.setLength(0);
                    used = 0;
                }
                current.append(text, start, end);
                used += cost;
            }
            current.append(text, wordEnd, index);
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    private static int wordTokens(String word) {
        return wordTokens(word.length());
    }

    private static int wordTokens(int length) {
        return Math.max(1, (length + 3) / 4);
    }
}
