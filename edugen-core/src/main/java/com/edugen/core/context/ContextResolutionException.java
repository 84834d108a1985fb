package com.edugen.core.context;

import lombok.Getter;

/**
 * The content a generation request points at could not be assembled into a context.
 */
@Getter
public class ContextResolutionException extends RuntimeException {
    
    public enum Reason { SOURCE_NOT_FOUND, NOT_READY, AUTH, CONNECTION }
    
    private final Reason reason;
    private final Long bookId;
    
    public ContextResolutionException(String message, Reason reason, Long bookId) {
        this(message, reason, bookId, null);
    }
    
    public ContextResolutionException(String message, Reason reason, Long bookId, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.bookId = bookId;
    }
}
