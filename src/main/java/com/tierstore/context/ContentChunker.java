package com.tierstore.context;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.tierstore.model.TokenEstimator;

/**
 * Splits text into line-aligned chunks under a token budget, repeating {@code overlapLines} lines
 * between neighbours. A line over the budget on its own is cut into numbered parts, each a chunk.
 */
public class ContentChunker {
    private final int maxTokens;
    private final int overlapLines;

    public ContentChunker(int maxTokens, int overlapLines) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        this.maxTokens = maxTokens;
        this.overlapLines = Math.max(0, overlapLines);
    }

    public List<ContentChunk> chunk(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String[] lines = content.split("\\R", -1);
        int lineCount = lines.length;
        while (lineCount > 1 && lines[lineCount - 1].isEmpty()) {
            lineCount--;
        }
        List<ContentChunk> chunks = new ArrayList<>();
        int start = 0;
        while (start < lineCount) {
            int firstCost = TokenEstimator.estimate(lines[start]);
            if (firstCost > maxTokens) {
                int part = 1;
                for (String piece : TokenEstimator.split(lines[start], maxTokens)) {
                    chunks.add(new ContentChunk(chunks.size(), start + 1, start + 1, piece,
                            TokenEstimator.estimate(piece), part++));
                }
                start++;
                continue;
            }
            int endExclusive = start;
            int tokens = 0;
            while (endExclusive < lineCount) {
                int cost = TokenEstimator.estimate(lines[endExclusive]);
                if (endExclusive > start && (tokens + cost > maxTokens || cost > maxTokens)) {
                    break;
                }
                tokens += cost;
                endExclusive++;
            }
            String text = String.join("\n", Arrays.copyOfRange(lines, start, endExclusive));
            chunks.add(new ContentChunk(chunks.size(), start + 1, endExclusive, text, tokens));
            if (endExclusive == lineCount) {
                break;
            }
            boolean nextOverlong = TokenEstimator.estimate(lines[endExclusive]) > maxTokens;
            start = nextOverlong ? endExclusive : Math.max(endExclusive - overlapLines, start + 1);
        }
        return chunks;
    }
}
