package com.tierstore.error;

import java.time.Duration;
import java.util.Map;

/** A caller waited longer than its admission timeout for a model capability slot. */
public class GatewayTimeoutException extends TierStoreException {
    public GatewayTimeoutException(String capability, Duration waited) {
        super(ErrorCode.TIMEOUT,
                "Timed out after " + waited.toMillis() + " ms waiting for " + capability + " capacity",
                Map.of("capability", capability, "waitedMs", waited.toMillis()));
    }
}
