package com.tierstore.error;

/** Missing or invalid backend / provider configuration. */
public class ConfigException extends TierStoreException {
    public ConfigException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
