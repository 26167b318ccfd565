package com.tierstore.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception carrying a stable {@link ErrorCode} and an immutable diagnostic context.
 */
public class TierStoreException extends RuntimeException {
    private final ErrorCode code;
    private final Map<String, Object> context;

    public TierStoreException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public TierStoreException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public TierStoreException(ErrorCode code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public TierStoreException(ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> context() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        input.forEach(copy::put);
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
