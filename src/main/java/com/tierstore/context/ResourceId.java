package com.tierstore.context;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.tierstore.registry.TenantScope;

/**
 * Identity of a resource inside its tenant scope. {@link #value()} is a SHA-256 hex digest of
 * {@code workspace:agent:uri}; record ids derive from it, so re-ingestion overwrites in place.
 */
public record ResourceId(TenantScope scope, String uri) {

    public String value() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] seed = (scope.workspace() + ":" + scope.agentKey() + ":" + uri).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(digest.digest(seed));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public String recordId(ContextLayer layer, int chunkIndex) {
        return switch (layer) {
            case L0 -> value() + "#L0";
            case L1 -> value() + "#L1";
            case L2 -> value() + "#L2-" + chunkIndex;
        };
    }

    @Override
    public String toString() {
        return scope + ":" + uri;
    }
}
