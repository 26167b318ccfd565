package com.tierstore.filter;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Compiles filter trees into in-process predicates over a record's scalar field map.
 */
public class PredicateFilterCompiler implements FilterCompiler<Predicate<Map<String, Object>>> {

    @Override
    public Predicate<Map<String, Object>> matchAll() {
        return fields -> true;
    }

    @Override
    public Predicate<Map<String, Object>> visitEq(FilterExpression.Eq eq) {
        return fields -> FilterValues.matchesEq(fields.get(eq.field()), eq.value());
    }

    @Override
    public Predicate<Map<String, Object>> visitIn(FilterExpression.In in) {
        return fields -> {
            Object value = fields.get(in.field());
            return in.values().stream().anyMatch(candidate -> FilterValues.matchesEq(value, candidate));
        };
    }

    @Override
    public Predicate<Map<String, Object>> visitRange(FilterExpression.Range range) {
        return fields -> FilterValues.inRange(fields.get(range.field()), range);
    }

    @Override
    public Predicate<Map<String, Object>> visitContains(FilterExpression.Contains contains) {
        return fields -> {
            Object value = fields.get(contains.field());
            return value != null && value.toString().contains(contains.substring());
        };
    }

    @Override
    public Predicate<Map<String, Object>> visitPathPrefix(FilterExpression.PathPrefix pathPrefix) {
        return fields -> {
            Object value = fields.get(pathPrefix.field());
            return value != null && value.toString().startsWith(pathPrefix.prefix());
        };
    }

    @Override
    public Predicate<Map<String, Object>> visitAnd(FilterExpression.And and) {
        List<Predicate<Map<String, Object>>> parts = and.conditions().stream().map(this::compile).toList();
        return fields -> parts.stream().allMatch(part -> part.test(fields));
    }

    @Override
    public Predicate<Map<String, Object>> visitOr(FilterExpression.Or or) {
        List<Predicate<Map<String, Object>>> parts = or.conditions().stream().map(this::compile).toList();
        return fields -> parts.stream().anyMatch(part -> part.test(fields));
    }

    @Override
    public Predicate<Map<String, Object>> visitNot(FilterExpression.Not not) {
        return compile(not.condition()).negate();
    }
}
