package com.tierstore.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tierstore.error.UnsupportedFilterException;

/**
 * Compiles filter trees into the JSON filter DSL used by remote vector services:
 * {@code must}, {@code must_not}, {@code range}, {@code contains}, {@code prefix}, {@code and} and
 * {@code or}.
 *
 * <p>Negation is pushed down to leaves with De Morgan's laws; only equality and membership can be
 * negated natively. Anything the dialect cannot express raises {@link UnsupportedFilterException}.
 */
public class DslFilterCompiler implements FilterCompiler<Map<String, Object>> {
    private final DslDialect dialect;

    public DslFilterCompiler(DslDialect dialect) {
        this.dialect = dialect;
    }

    public DslDialect dialect() {
        return dialect;
    }

    @Override
    public Map<String, Object> matchAll() {
        return Map.of();
    }

    @Override
    public Map<String, Object> visitEq(FilterExpression.Eq eq) {
        return membership("must", eq.field(), List.of(FilterValues.normalize(eq.value())));
    }

    @Override
    public Map<String, Object> visitIn(FilterExpression.In in) {
        return membership("must", in.field(), normalized(in.values()));
    }

    @Override
    public Map<String, Object> visitRange(FilterExpression.Range range) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("op", "range");
        node.put("field", range.field());
        putBound(node, "gte", range.gte());
        putBound(node, "gt", range.gt());
        putBound(node, "lte", range.lte());
        putBound(node, "lt", range.lt());
        return node;
    }

    @Override
    public Map<String, Object> visitContains(FilterExpression.Contains contains) {
        if (!dialect.supportsContains()) {
            throw new UnsupportedFilterException(dialect.backend(), "contains");
        }
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("op", "contains");
        node.put("field", contains.field());
        node.put("substring", contains.substring());
        return node;
    }

    @Override
    public Map<String, Object> visitPathPrefix(FilterExpression.PathPrefix pathPrefix) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("op", "prefix");
        node.put("field", pathPrefix.field());
        node.put("prefix", pathPrefix.prefix());
        return node;
    }

    @Override
    public Map<String, Object> visitAnd(FilterExpression.And and) {
        return group("and", and.conditions().stream().map(this::compile).toList());
    }

    @Override
    public Map<String, Object> visitOr(FilterExpression.Or or) {
        if (!dialect.supportsOr()) {
            throw new UnsupportedFilterException(dialect.backend(), "or");
        }
        return group("or", or.conditions().stream().map(this::compile).toList());
    }

    @Override
    public Map<String, Object> visitNot(FilterExpression.Not not) {
        if (!dialect.supportsNegation()) {
            throw new UnsupportedFilterException(dialect.backend(), "not");
        }
        return not.condition().accept(new Negation());
    }

    private Map<String, Object> membership(String op, String field, List<Object> values) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("op", op);
        node.put("field", field);
        node.put("conds", values);
        return node;
    }

    private static Map<String, Object> group(String op, List<Map<String, Object>> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("op", op);
        node.put("conds", children);
        return node;
    }

    private static void putBound(Map<String, Object> node, String key, Object bound) {
        if (bound != null) {
            node.put(key, FilterValues.normalize(bound));
        }
    }

    private static List<Object> normalized(List<Object> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Object value : values) {
            out.add(FilterValues.normalize(value));
        }
        return out;
    }

    private final class Negation implements FilterVisitor<Map<String, Object>> {
        @Override
        public Map<String, Object> visitEq(FilterExpression.Eq eq) {
            return membership("must_not", eq.field(), List.of(FilterValues.normalize(eq.value())));
        }

        @Override
        public Map<String, Object> visitIn(FilterExpression.In in) {
            return membership("must_not", in.field(), normalized(in.values()));
        }

        @Override
        public Map<String, Object> visitRange(FilterExpression.Range range) {
            throw new UnsupportedFilterException(dialect.backend(), "not(range on " + range.field() + ")");
        }

        @Override
        public Map<String, Object> visitContains(FilterExpression.Contains contains) {
            throw new UnsupportedFilterException(dialect.backend(), "not(contains on " + contains.field() + ")");
        }

        @Override
        public Map<String, Object> visitPathPrefix(FilterExpression.PathPrefix pathPrefix) {
            throw new UnsupportedFilterException(dialect.backend(), "not(prefix on " + pathPrefix.field() + ")");
        }

        @Override
        public Map<String, Object> visitAnd(FilterExpression.And and) {
            if (!dialect.supportsOr()) {
                throw new UnsupportedFilterException(dialect.backend(), "not(and) requires or");
            }
            return group("or", and.conditions().stream().map(child -> child.accept(this)).toList());
        }

        @Override
        public Map<String, Object> visitOr(FilterExpression.Or or) {
            return group("and", or.conditions().stream().map(child -> child.accept(this)).toList());
        }

        @Override
        public Map<String, Object> visitNot(FilterExpression.Not not) {
            return compile(not.condition());
        }
    }
}
