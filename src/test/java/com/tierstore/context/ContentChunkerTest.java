package com.tierstore.context;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentChunkerTest {

    @Test
    void shouldSplitUnderBudgetWithOverlappingLines() {
        List<String> lines = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            lines.add("line " + i);
        }

        List<ContentChunk> chunks = new ContentChunker(6, 1).chunk(String.join("\n", lines));

        assertEquals(1, chunks.get(0).startLine());
        assertEquals(3, chunks.get(0).endLine());
        assertEquals(10, chunks.get(chunks.size() - 1).endLine());
        for (int i = 0; i < chunks.size(); i++) {
            ContentChunk chunk = chunks.get(i);
            assertEquals(i, chunk.index());
            assertTrue(chunk.tokens() <= 6, "chunk " + i + " over budget");
            if (i > 0) {
                assertEquals(chunks.get(i - 1).endLine(), chunk.startLine());
            }
        }
    }

    @Test
    void shouldCutOverlongLineIntoNumberedParts() {
        String longLine = "a ".repeat(20).strip();

        List<ContentChunk> chunks = new ContentChunker(5, 2).chunk("intro\n" + longLine + "\noutro");

        assertEquals(6, chunks.size());
        assertEquals("intro", chunks.get(0).text());
        assertEquals("outro", chunks.get(5).text());
        StringBuilder joined = new StringBuilder();
        for (int i = 1; i <= 4; i++) {
            ContentChunk part = chunks.get(i);
            assertEquals(i, part.index());
            assertEquals(2, part.startLine());
            assertEquals(2, part.endLine());
            assertEquals(i, part.part());
            assertTrue(part.tokens() <= 5);
            assertEquals(i, ContentChunk.partOf(part.anchor()));
            joined.append(part.text());
        }
        assertEquals(longLine, joined.toString());
        assertEquals("[section 3 | lines 2-2 | part 2]", chunks.get(2).anchor());
        assertEquals(2, ContentChunk.startLineOf(chunks.get(2).anchor()));
    }

    @Test
    void shouldHardCutSingleWordLongerThanBudget() {
        String word = "x".repeat(50);

        List<ContentChunk> chunks = new ContentChunker(3, 0).chunk(word);

        assertEquals(List.of(12, 12, 12, 12, 2), chunks.stream().map(chunk -> chunk.text().length()).toList());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.tokens() <= 3));
    }

    @Test
    void shouldIgnoreBlankContentAndTrailingEmptyLines() {
        ContentChunker chunker = new ContentChunker(100, 2);

        assertTrue(chunker.chunk("   ").isEmpty());
        List<ContentChunk> chunks = chunker.chunk("first\n\nsecond\n\n\n");
        assertEquals(1, chunks.size());
        assertEquals(3, chunks.get(0).endLine());
        assertEquals("first\n\nsecond", chunks.get(0).text());
    }

    @Test
    void shouldParseStartLineFromAnchor() {
        ContentChunk chunk = new ContentChunk(2, 41, 60, "text", 1);

        assertEquals("[section 3 | lines 41-60]", chunk.anchor());
        assertEquals(41, ContentChunk.startLineOf(chunk.anchor()));
        assertEquals(-1, ContentChunk.startLineOf("no range here"));
        assertEquals(-1, ContentChunk.startLineOf(null));
        assertEquals(0, ContentChunk.partOf(chunk.anchor()));
    }
}
