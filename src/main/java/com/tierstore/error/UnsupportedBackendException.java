package com.tierstore.error;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public class UnsupportedBackendException extends TierStoreException {
    public UnsupportedBackendException(String backend, Collection<String> available) {
        super(ErrorCode.UNSUPPORTED_BACKEND,
                "Vector backend '" + backend + "' is not supported. Available backends: " + available,
                Map.of("backend", String.valueOf(backend), "available", List.copyOf(available)));
    }
}
