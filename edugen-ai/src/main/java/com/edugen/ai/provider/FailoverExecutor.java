package com.edugen.ai.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Folds an ordered provider chain into one call.
 *
 * Each provider is tried with its own retry budget; every attempt becomes an
 * {@link AttemptResult} handed to the listener before the next decision is made.
 * The first successful value is returned. When the chain is exhausted an
 * {@link AllProvidersFailedException} lists every provider in the order tried.
 */
@Slf4j
public class FailoverExecutor {
    
    private final ExecutorService executor;
    private final RetryPolicy defaultPolicy;
    private final String tag;
    
    public FailoverExecutor(ExecutorService executor, RetryPolicy defaultPolicy, String tag) {
        this.executor = executor;
        this.defaultPolicy = defaultPolicy;
        this.tag = tag;
    }
    
    @FunctionalInterface
    public interface ProviderCall<P, T> {
        T call(P provider);
    }
    
    @FunctionalInterface
    public interface AttemptListener<P, T> {
        void onAttempt(P provider, AttemptResult<T> result);
    }
    
    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }
    
    public <P extends AiProvider, T> T execute(String requestId, List<P> chain,
                                               ProviderCall<P, T> call, AttemptListener<P, T> listener) {
        return execute(requestId, chain, defaultPolicy, call, listener);
    }
    
    public <P extends AiProvider, T> T execute(String requestId, List<P> chain, RetryPolicy policy,
                                               ProviderCall<P, T> call, AttemptListener<P, T> listener) {
        if (chain.isEmpty()) {
            throw new ProviderUnavailableException("No " + tag + " provider is configured");
        }
        
        long requestStartTime = System.currentTimeMillis();
        log.info("[FAILOVER] Starting {} request | requestId={} | chain={} | maxRetries={} | attemptTimeoutMs={}", 
            tag, requestId, names(chain), policy.maxRetries(), policy.attemptTimeout().toMillis());
        
        List<ProviderFailure> failures = new ArrayList<>();
        
        for (P provider : chain) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[FAILOVER] Request cancelled, not scheduling further providers | requestId={} | failedSoFar={}", 
                    requestId, failures.size());
                throw new AllProvidersFailedException(failures, true);
            }
            
            AttemptResult<T> last = attemptWithRetry(requestId, provider, policy, call, listener);
            
            if (last.isOk()) {
                log.info("[FAILOVER] Request succeeded | requestId={} | provider={} | attempts={} | totalDurationMs={}", 
                    requestId, provider.getName(), last.getAttemptNumber(), 
                    System.currentTimeMillis() - requestStartTime);
                return last.getValue();
            }
            
            failures.add(ProviderFailure.from(last));
            log.warn("[FAILOVER] Provider exhausted, moving on | requestId={} | provider={} | kind={} | attempts={} | error={}", 
                requestId, provider.getName(), last.getError().getKind(), last.getAttemptNumber(), 
                last.getError().getMessage());
        }
        
        log.error("[FAILOVER] All providers failed | requestId={} | attemptedProviders={} | totalDurationMs={}", 
            requestId, failures.stream().map(ProviderFailure::provider).collect(Collectors.joining(",")),
            System.currentTimeMillis() - requestStartTime);
        
        throw new AllProvidersFailedException(failures, Thread.currentThread().isInterrupted());
    }
    
    private <P extends AiProvider, T> AttemptResult<T> attemptWithRetry(String requestId, P provider, RetryPolicy policy,
                                                                       ProviderCall<P, T> call,
                                                                       AttemptListener<P, T> listener) {
        AttemptResult<T> last = null;
        
        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            last = attemptOnce(provider, attempt + 1, policy, call);
            notifyListener(listener, provider, last);
            
            if (last.isOk()) {
                return last;
            }
            
            ProviderException error = last.getError();
            long delay = policy.delayBefore(attempt, error);
            
            log.warn("[FAILOVER] Attempt failed | requestId={} | provider={} | attempt={}/{} | kind={} | statusCode={} | retry={} | durationMs={} | error={}", 
                requestId, provider.getName(), attempt + 1, policy.maxRetries() + 1, error.getKind(), 
                error.getStatusCode(), delay != RetryPolicy.NO_RETRY, last.getDurationMs(), error.getMessage());
            
            if (delay == RetryPolicy.NO_RETRY || Thread.currentThread().isInterrupted()) {
                break;
            }
            
            log.info("[FAILOVER] Backing off before retry | requestId={} | provider={} | waitMs={}", 
                requestId, provider.getName(), delay);
            if (!sleep(delay)) {
                break;
            }
        }
        return last;
    }
    
    private <P extends AiProvider, T> AttemptResult<T> attemptOnce(P provider, int attemptNumber, RetryPolicy policy,
                                                                  ProviderCall<P, T> call) {
        long startTime = System.currentTimeMillis();
        long timeoutMs = policy.attemptTimeout().toMillis();
        Future<T> future = executor.submit(() -> call.call(provider));
        
        try {
            T value = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return AttemptResult.ok(provider.getName(), attemptNumber, value, System.currentTimeMillis() - startTime);
        } catch (TimeoutException e) {
            future.cancel(true);
            ProviderException timeout = new ProviderException(
                "Attempt exceeded " + timeoutMs + "ms", ProviderErrorKind.TIMEOUT, provider.getName(), e);
            return AttemptResult.err(provider.getName(), attemptNumber, timeout, System.currentTimeMillis() - startTime);
        } catch (ExecutionException e) {
            ProviderException error = classify(provider, e.getCause());
            return AttemptResult.err(provider.getName(), attemptNumber, error, System.currentTimeMillis() - startTime);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            ProviderException cancelled = new ProviderException(
                "Request cancelled", ProviderErrorKind.CONNECTION, provider.getName(), e);
            return AttemptResult.err(provider.getName(), attemptNumber, cancelled, System.currentTimeMillis() - startTime);
        }
    }
    
    private ProviderException classify(AiProvider provider, Throwable cause) {
        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }
        log.error("[FAILOVER] Unclassified provider failure | provider={} | error={}", 
            provider.getName(), cause != null ? cause.toString() : "unknown", cause);
        return new ProviderException(
            "Unexpected " + provider.getName() + " failure: " + (cause != null ? cause.getMessage() : "unknown"),
            ProviderErrorKind.RESPONSE, provider.getName(), cause);
    }
    
    private <P, T> void notifyListener(AttemptListener<P, T> listener, P provider, AttemptResult<T> result) {
        if (listener == null) {
            return;
        }
        try {
            listener.onAttempt(provider, result);
        } catch (RuntimeException e) {
            log.warn("[FAILOVER] Attempt listener failed | provider={} | error={}", result.getProvider(), e.getMessage(), e);
        }
    }
    
    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
    
    private static String names(List<? extends AiProvider> chain) {
        return chain.stream().map(AiProvider::getName).collect(Collectors.joining(" -> "));
    }
}
