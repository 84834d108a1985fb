package com.edugen.core.content;

import lombok.Getter;

/**
 * Failure talking to the content store. Missing resources are not errors; the
 * client returns an empty result for those.
 */
@Getter
public class ContentStoreException extends RuntimeException {
    
    public enum Kind { NOT_READY, AUTH, CONNECTION }
    
    private final Kind kind;
    private final Long bookId;
    
    public ContentStoreException(String message, Kind kind, Long bookId, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.bookId = bookId;
    }
}
