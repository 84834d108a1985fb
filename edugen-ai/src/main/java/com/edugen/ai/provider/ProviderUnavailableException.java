package com.edugen.ai.provider;

/**
 * Generation is disabled or no provider has credentials configured.
 */
public class ProviderUnavailableException extends RuntimeException {
    
    public ProviderUnavailableException(String message) {
        super(message);
    }
}
