package com.tierstore.filter;

/**
 * Capabilities of a JSON filter dialect spoken by a remote vector service.
 *
 * @param backend          backend key used in error messages
 * @param supportsOr       whether {@code or} groups are accepted
 * @param supportsNegation whether {@code must_not} is accepted
 * @param supportsContains whether substring matching is accepted
 */
public record DslDialect(String backend, boolean supportsOr, boolean supportsNegation, boolean supportsContains) {

    public static DslDialect full(String backend) {
        return new DslDialect(backend, true, true, true);
    }
}
