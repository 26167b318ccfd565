package com.tierstore.error;

import java.util.Map;

public class ModelUnavailableException extends TierStoreException {
    public ModelUnavailableException(String capability, int attempts, Throwable cause) {
        super(ErrorCode.MODEL_UNAVAILABLE,
                capability + " provider unavailable after " + attempts + " attempt(s)",
                Map.of("capability", capability, "attempts", attempts),
                cause);
    }

    public ModelUnavailableException(String message) {
        super(ErrorCode.MODEL_UNAVAILABLE, message);
    }
}
