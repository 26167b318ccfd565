package com.tierstore.error;

import java.util.Map;

public class UnsupportedFilterException extends TierStoreException {
    public UnsupportedFilterException(String backend, String construct) {
        super(ErrorCode.UNSUPPORTED_FILTER,
                "Backend '" + backend + "' cannot express filter construct: " + construct,
                Map.of("backend", backend, "construct", construct));
    }
}
