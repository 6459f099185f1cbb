package com.pathway.aggregator.aggregate.provider;

public class ProviderException extends RuntimeException {
    private final String provider;
    private final String reason;

    public ProviderException(String provider, String reason, String message) {
        super(provider + " failed (" + reason + "): " + message);
        this.provider = provider;
        this.reason = reason;
    }

    public ProviderException(String provider, String reason, String message, Throwable cause) {
        super(provider + " failed (" + reason + "): " + message, cause);
        this.provider = provider;
        this.reason = reason;
    }

    public String provider() {
        return provider;
    }

    public String reason() {
        return reason;
    }
}
