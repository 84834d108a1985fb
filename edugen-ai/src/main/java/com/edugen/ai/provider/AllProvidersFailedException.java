package com.edugen.ai.provider;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider in the chain failed. Failures are listed in attempt order.
 */
@Getter
public class AllProvidersFailedException extends RuntimeException {
    
    private final List<ProviderFailure> failures;
    private final boolean cancelled;
    
    public AllProvidersFailedException(List<ProviderFailure> failures, boolean cancelled) {
        super(buildMessage(failures, cancelled));
        this.failures = List.copyOf(failures);
        this.cancelled = cancelled;
    }
    
    public List<String> getAttemptedProviders() {
        return failures.stream().map(ProviderFailure::provider).collect(Collectors.toList());
    }
    
    public int getTotalAttempts() {
        return failures.stream().mapToInt(ProviderFailure::attempts).sum();
    }
    
    private static String buildMessage(List<ProviderFailure> failures, boolean cancelled) {
        String detail = failures.stream()
            .map(f -> f.provider() + " (" + f.kind() + ": " + f.message() + ")")
            .collect(Collectors.joining(", "));
        return (cancelled ? "Request cancelled after provider failures: " : "All providers failed: ") + detail;
    }
}
