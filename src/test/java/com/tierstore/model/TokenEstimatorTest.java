package com.tierstore.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenEstimatorTest {

    @Test
    void shouldCountWordsAndLongWordPieces() {
        assertEquals(0, TokenEstimator.estimate("  "));
        assertEquals(3, TokenEstimator.estimate("the big fox"));
        assertEquals(2, TokenEstimator.estimate("quick"));
        assertEquals(5, TokenEstimator.estimate("internationalization"));
    }

    @Test
    void shouldTruncateAtWordBoundaries() {
        assertEquals("alpha beta", TokenEstimator.truncate("alpha beta gamma delta", 3));
        assertEquals("short text", TokenEstimator.truncate("  short text  ", 10));
        assertEquals("", TokenEstimator.truncate(null, 5));
    }

    @Test
    void shouldSplitIntoPiecesThatJoinBackToTheInput() {
        String text = "  alpha beta gamma delta epsilon";

        List<String> pieces = TokenEstimator.split(text, 4);

        assertEquals(List.of("  alpha beta ", "gamma delta ", "epsilon"), pieces);
        assertEquals(text, String.join("", pieces));
        assertTrue(pieces.stream().allMatch(piece -> TokenEstimator.estimate(piece) <= 4));
        assertTrue(TokenEstimator.split("", 3).isEmpty());
    }

    @Test
    void shouldKeepLineBreaksInsideTheKeptPrefix() {
        assertEquals("one\ntwo", TokenEstimator.truncate("one\ntwo three", 2));
    }
}
