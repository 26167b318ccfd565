package com.tierstore.filter;

/**
 * Translates a {@link FilterExpression} into one backend's native filter representation.
 *
 * <p>Each node type has exactly one emission rule. Implementations throw
 * {@link com.tierstore.error.UnsupportedFilterException} for constructs the backend cannot
 * express instead of dropping them.
 */
public interface FilterCompiler<R> extends FilterVisitor<R> {

    /** Native form that selects every record. */
    R matchAll();

    default R compile(FilterExpression expression) {
        if (expression == null) {
            return matchAll();
        }
        return expression.accept(this);
    }
}
