package com.marketrouter.common.exception;

/**
 * Root of the unchecked exception hierarchy. When a provider is involved its id
 * prefixes the message as {@code [providerId]}.
 */
public class MarketDataException extends RuntimeException {
    private final String providerId;

    public MarketDataException(String message) {
        super(message);
        this.providerId = null;
    }

    public MarketDataException(String providerId, String message) {
        super(prefix(providerId) + message);
        this.providerId = providerId;
    }

    public MarketDataException(String providerId, String message, Throwable cause) {
        super(prefix(providerId) + message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    private static String prefix(String providerId) {
        return providerId == null ? "" : "[" + providerId + "] ";
    }
}
