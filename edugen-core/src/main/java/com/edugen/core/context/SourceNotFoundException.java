package com.edugen.core.context;

import lombok.Getter;

import java.util.List;

@Getter
public class SourceNotFoundException extends ContextResolutionException {
    
    private final List<Long> moduleIds;
    
    public SourceNotFoundException(Long bookId, List<Long> moduleIds) {
        super(moduleIds == null || moduleIds.isEmpty()
                ? "No modules found for book " + bookId
                : "None of modules " + moduleIds + " found in book " + bookId,
            Reason.SOURCE_NOT_FOUND, bookId);
        this.moduleIds = moduleIds == null ? List.of() : List.copyOf(moduleIds);
    }
}
