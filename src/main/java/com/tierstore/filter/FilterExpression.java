package com.tierstore.filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, backend-neutral predicate tree over scalar fields.
 *
 * <p>Trees are translated into a backend's native form by a {@link FilterCompiler}. A {@code null}
 * expression means "match every record".
 */
public interface FilterExpression {

    <R> R accept(FilterVisitor<R> visitor);

    static FilterExpression eq(String field, Object value) {
        return new Eq(field, value);
    }

    static FilterExpression in(String field, List<?> values) {
        return new In(field, new ArrayList<Object>(values));
    }

    static FilterExpression in(String field, Object... values) {
        return new In(field, new ArrayList<Object>(Arrays.asList(values)));
    }

    static FilterExpression gte(String field, Object value) {
        return new Range(field, value, null, null, null);
    }

    static FilterExpression lt(String field, Object value) {
        return new Range(field, null, null, null, value);
    }

    static FilterExpression between(String field, Object fromInclusive, Object toExclusive) {
        return new Range(field, fromInclusive, null, null, toExclusive);
    }

    static FilterExpression contains(String field, String substring) {
        return new Contains(field, substring);
    }

    /**
     * Matches path-like values lying beneath {@code directory}, for example every
     * {@code resource://docs/...} URI under {@code resource://docs}.
     */
    static FilterExpression under(String field, String directory) {
        return new PathPrefix(field, directory);
    }

    static FilterExpression and(FilterExpression... conditions) {
        return new And(Arrays.asList(conditions));
    }

    static FilterExpression or(FilterExpression... conditions) {
        return new Or(Arrays.asList(conditions));
    }

    static FilterExpression not(FilterExpression condition) {
        return new Not(condition);
    }

    /**
     * Conjunction of the non-null arguments; {@code null} when none remain, the sole condition when
     * only one does.
     */
    static FilterExpression allOf(FilterExpression... conditions) {
        List<FilterExpression> present = new ArrayList<>();
        for (FilterExpression condition : conditions) {
            if (condition != null) {
                present.add(condition);
            }
        }
        if (present.isEmpty()) {
            return null;
        }
        if (present.size() == 1) {
            return present.get(0);
        }
        return new And(present);
    }

    record Eq(String field, Object value) implements FilterExpression {
        public Eq {
            requireField(field);
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitEq(this);
        }
    }

    record In(String field, List<Object> values) implements FilterExpression {
        public In {
            requireField(field);
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("In filter on '" + field + "' requires at least one value");
            }
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    record Range(String field, Object gte, Object gt, Object lte, Object lt) implements FilterExpression {
        public Range {
            requireField(field);
            if (gte == null && gt == null && lte == null && lt == null) {
                throw new IllegalArgumentException("Range filter on '" + field + "' requires at least one bound");
            }
            if (gte != null && gt != null) {
                throw new IllegalArgumentException("Range filter on '" + field + "' cannot combine gte and gt");
            }
            if (lte != null && lt != null) {
                throw new IllegalArgumentException("Range filter on '" + field + "' cannot combine lte and lt");
            }
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    record Contains(String field, String substring) implements FilterExpression {
        public Contains {
            requireField(field);
            Objects.requireNonNull(substring, "substring");
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitContains(this);
        }
    }

    record PathPrefix(String field, String directory) implements FilterExpression {
        public PathPrefix {
            requireField(field);
            Objects.requireNonNull(directory, "directory");
            while (directory.endsWith("/")) {
                directory = directory.substring(0, directory.length() - 1);
            }
            if (directory.isBlank()) {
                throw new IllegalArgumentException("PathPrefix filter on '" + field + "' requires a directory");
            }
        }

        /** The directory with its trailing separator; matching values start with it. */
        public String prefix() {
            return directory + "/";
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitPathPrefix(this);
        }
    }

    record And(List<FilterExpression> conditions) implements FilterExpression {
        public And {
            conditions = requireConditions("and", conditions);
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(List<FilterExpression> conditions) implements FilterExpression {
        public Or {
            conditions = requireConditions("or", conditions);
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(FilterExpression condition) implements FilterExpression {
        public Not {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public <R> R accept(FilterVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    private static void requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("filter field must not be blank");
        }
    }

    private static List<FilterExpression> requireConditions(String op, List<FilterExpression> conditions) {
        Objects.requireNonNull(conditions, op + " conditions");
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException(op + " filter requires at least one condition");
        }
        for (FilterExpression condition : conditions) {
            Objects.requireNonNull(condition, op + " condition");
        }
        return List.copyOf(conditions);
    }
}
