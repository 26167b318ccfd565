package com.tierstore.filter;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Value comparison shared by in-process filter evaluation. Numbers compare by value regardless of
 * boxed type, instants compare as epoch milliseconds, everything else by {@code equals} or natural
 * string order.
 */
public final class FilterValues {
    private FilterValues() {
    }

    public static boolean matchesEq(Object recordValue, Object expected) {
        if (recordValue == null) {
            return false;
        }
        if (recordValue instanceof Collection<?> values) {
            return values.stream().anyMatch(value -> valueEquals(value, expected));
        }
        return valueEquals(recordValue, expected);
    }

    public static boolean valueEquals(Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * @return negative, zero or positive like {@link Comparable#compareTo}, or {@code null} when the
     *         values are not comparable with each other
     */
    public static Integer compare(Object left, Object right) {
        Object a = normalize(left);
        Object b = normalize(right);
        if (a == null || b == null) {
            return null;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        return null;
    }

    public static boolean inRange(Object recordValue, FilterExpression.Range range) {
        if (recordValue == null) {
            return false;
        }
        if (range.gte() != null && !satisfies(compare(recordValue, range.gte()), c -> c >= 0)) {
            return false;
        }
        if (range.gt() != null && !satisfies(compare(recordValue, range.gt()), c -> c > 0)) {
            return false;
        }
        if (range.lte() != null && !satisfies(compare(recordValue, range.lte()), c -> c <= 0)) {
            return false;
        }
        return range.lt() == null || satisfies(compare(recordValue, range.lt()), c -> c < 0);
    }

    static Object normalize(Object value) {
        if (value instanceof Instant instant) {
            return instant.toEpochMilli();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }

    private static boolean satisfies(Integer comparison, IntPredicate test) {
        return comparison != null && test.test(comparison);
    }
}
