package com.tierstore.context;

import java.io.IOException;

/**
 * Byte-storage capability resolving payload references.
 */
@FunctionalInterface
public interface ContentFetcher {

    byte[] fetchBytes(String uri) throws IOException;

    static ContentFetcher unavailable() {
        return uri -> {
            throw new IOException("no content fetcher configured for " + uri);
        };
    }
}
