package com.tierstore.context;

import com.tierstore.registry.TenantScope;

/**
 * A resource to ingest. Content is either inline text or a reference resolved through a
 * {@link ContentFetcher}.
 */
public record ResourceInput(
        String uri,
        ContentType contentType,
        TenantScope scope,
        String inlineText,
        String payloadRef,
        String mimeType,
        String name,
        String parentUri) {

    public ResourceInput {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("resource uri must not be blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("resource " + uri + " has no tenant scope");
        }
        if (inlineText == null && (payloadRef == null || payloadRef.isBlank())) {
            throw new IllegalArgumentException("resource " + uri + " needs inline text or a payload reference");
        }
        if (contentType == ContentType.IMAGE && payloadRef == null) {
            throw new IllegalArgumentException("image resource " + uri + " needs a payload reference");
        }
        contentType = contentType == null ? ContentType.TEXT : contentType;
        name = name == null || name.isBlank() ? lastSegment(uri) : name;
        parentUri = parentUri == null ? "" : parentUri;
    }

    public static ResourceInput text(TenantScope scope, String uri, String text) {
        return new ResourceInput(uri, ContentType.TEXT, scope, text, null, "text/plain", null, null);
    }

    public static ResourceInput stored(TenantScope scope, String uri, ContentType type, String payloadRef, String mimeType) {
        return new ResourceInput(uri, type, scope, null, payloadRef, mimeType, null, null);
    }

    public boolean isInline() {
        return inlineText != null;
    }

    public ResourceId id() {
        return new ResourceId(scope, uri);
    }

    private static String lastSegment(String uri) {
        String trimmed = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
