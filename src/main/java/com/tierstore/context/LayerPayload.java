package com.tierstore.context;

import java.nio.charset.StandardCharsets;

/**
 * Content of one layer of a stored resource. {@code bytes} is set when L2 was resolved through
 * the byte store; {@code text} is empty for image payloads.
 */
public record LayerPayload(ResourceId id, ContextLayer layer, ContentType contentType, String text, byte[] bytes, String l2Ref) {

    public static LayerPayload text(ResourceId id, ContextLayer layer, ContentType type, String text) {
        return new LayerPayload(id, layer, type, text == null ? "" : text, null, "");
    }

    public static LayerPayload fetched(ResourceId id, ContentType type, byte[] bytes, String l2Ref) {
        String text = type == ContentType.IMAGE ? "" : new String(bytes, StandardCharsets.UTF_8);
        return new LayerPayload(id, ContextLayer.L2, type, text, bytes, l2Ref);
    }

    public boolean hasBytes() {
        return bytes != null;
    }

    @Override
    public String toString() {
        return "LayerPayload{id=" + id + ", layer=" + layer + ", contentType=" + contentType
                + ", chars=" + text.length() + ", bytes=" + (bytes == null ? 0 : bytes.length)
                + ", l2Ref=" + l2Ref + "}";
    }
}
