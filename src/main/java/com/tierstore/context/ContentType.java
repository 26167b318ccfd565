package com.tierstore.context;

import java.util.Locale;

public enum ContentType {
    TEXT,
    IMAGE,
    MIXED;

    public static ContentType fromMimeType(String mimeType) {
        if (mimeType == null) {
            return TEXT;
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("image/")) {
            return IMAGE;
        }
        if (normalized.startsWith("multipart/")) {
            return MIXED;
        }
        return TEXT;
    }
}
