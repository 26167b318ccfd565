package com.tierstore.filter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tierstore.error.UnsupportedFilterException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DslFilterCompilerTest {

    private final DslFilterCompiler full = new DslFilterCompiler(DslDialect.full("http"));
    private final DslFilterCompiler restricted = new DslFilterCompiler(new DslDialect("managed", true, false, false));

    @Test
    void shouldCompileNullToMatchAll() {
        assertTrue(full.compile(null).isEmpty());
    }

    @Test
    void shouldCompileEqualityAndMembershipToMust() {
        assertEquals(Map.of("op", "must", "field", "workspace", "conds", List.of("acme")),
                full.compile(FilterExpression.eq("workspace", "acme")));
        assertEquals(Map.of("op", "must", "field", "agent", "conds", List.of("a1", "")),
                full.compile(FilterExpression.in("agent", "a1", "")));
    }

    @Test
    void shouldCompileRangeWithInstantBoundsAsEpochMillis() {
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Map<String, Object> compiled = full.compile(FilterExpression.between("created_at", from, 2_000_000_000_000L));

        assertEquals("range", compiled.get("op"));
        assertEquals(from.toEpochMilli(), compiled.get("gte"));
        assertEquals(2_000_000_000_000L, compiled.get("lt"));
    }

    @Test
    void shouldCompileDirectoryScopeToPrefixInEveryDialect() {
        Map<String, Object> expected = Map.of("op", "prefix", "field", "uri", "prefix", "resource://docs/");

        assertEquals(expected, full.compile(FilterExpression.under("uri", "resource://docs")));
        assertEquals(expected, restricted.compile(FilterExpression.under("uri", "resource://docs/")));
        assertThrows(UnsupportedFilterException.class,
                () -> full.compile(FilterExpression.not(FilterExpression.under("uri", "resource://docs"))));
    }

    @Test
    void shouldCollapseSingleChildGroups() {
        FilterExpression only = FilterExpression.eq("level", 0L);
        assertEquals(full.compile(only), full.compile(FilterExpression.and(only)));
    }

    @Test
    void shouldPushNegationDownWithDeMorgan() {
        Map<String, Object> compiled = full.compile(FilterExpression.not(FilterExpression.or(
                FilterExpression.eq("level", 0L),
                FilterExpression.in("agent", "a", "b"))));

        assertEquals("and", compiled.get("op"));
        List<?> children = (List<?>) compiled.get("conds");
        Map<?, ?> level = (Map<?, ?>) children.get(0);
        Map<?, ?> agent = (Map<?, ?>) children.get(1);
        assertEquals("must_not", level.get("op"));
        assertEquals("must_not", agent.get("op"));
        assertEquals(List.of("a", "b"), agent.get("conds"));
    }

    @Test
    void shouldCancelDoubleNegation() {
        FilterExpression eq = FilterExpression.eq("uri", "resource://a");
        assertEquals(full.compile(eq), full.compile(FilterExpression.not(FilterExpression.not(eq))));
    }

    @Test
    void shouldRejectNegatedRangeInsteadOfDroppingIt() {
        assertThrows(UnsupportedFilterException.class,
                () -> full.compile(FilterExpression.not(FilterExpression.gte("level", 1L))));
    }

    @Test
    void shouldRejectConstructsOutsideTheDialect() {
        UnsupportedFilterException negation = assertThrows(UnsupportedFilterException.class,
                () -> restricted.compile(FilterExpression.and(
                        FilterExpression.eq("workspace", "w"),
                        FilterExpression.not(FilterExpression.eq("agent", "x")))));
        assertTrue(negation.getMessage().contains("not"));

        assertThrows(UnsupportedFilterException.class,
                () -> restricted.compile(FilterExpression.contains("name", "kick")));
    }
}
