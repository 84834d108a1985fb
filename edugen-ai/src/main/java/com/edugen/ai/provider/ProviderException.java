package com.edugen.ai.provider;

/**
 * A single provider failure, already classified into {@link ProviderErrorKind}.
 * Raw vendor exceptions never leave a provider client; they arrive wrapped as the cause.
 */
public class ProviderException extends RuntimeException {
    
    private final ProviderErrorKind kind;
    private final String provider;
    private final int statusCode;
    private final Integer retryAfterSeconds;
    
    public ProviderException(String message, ProviderErrorKind kind, String provider) {
        this(message, kind, provider, 0, null, null);
    }
    
    public ProviderException(String message, ProviderErrorKind kind, String provider, Throwable cause) {
        this(message, kind, provider, 0, null, cause);
    }
    
    public ProviderException(String message, ProviderErrorKind kind, String provider,
                             int statusCode, Integer retryAfterSeconds, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryAfterSeconds = retryAfterSeconds;
    }
    
    public ProviderErrorKind getKind() { return kind; }
    public String getProvider() { return provider; }
    public int getStatusCode() { return statusCode; }
    public Integer getRetryAfterSeconds() { return retryAfterSeconds; }
    public boolean isTransient() { return kind.isTransientError(); }
    public boolean isRateLimited() { return kind == ProviderErrorKind.RATE_LIMIT; }
    public boolean isAuthError() { return kind == ProviderErrorKind.AUTHENTICATION; }
}
