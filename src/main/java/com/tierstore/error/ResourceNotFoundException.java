package com.tierstore.error;

import java.util.Map;

public class ResourceNotFoundException extends TierStoreException {
    public ResourceNotFoundException(String uri, String detail) {
        super(ErrorCode.NOT_FOUND, "Resource " + uri + " not found: " + detail, Map.of("uri", uri));
    }

    public ResourceNotFoundException(String uri, String detail, Throwable cause) {
        super(ErrorCode.NOT_FOUND, "Resource " + uri + " not found: " + detail, Map.of("uri", uri), cause);
    }
}
