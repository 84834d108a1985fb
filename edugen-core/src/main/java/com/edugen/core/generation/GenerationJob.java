package com.edugen.core.generation;

import com.edugen.core.context.MetadataContext;
import com.edugen.core.generation.model.DifficultySelection;
import com.edugen.core.generation.model.GenerationRequest;

/**
 * Inputs shared by prompt building and normalization for one generation call.
 */
public record GenerationJob(GenerationRequest request, MetadataContext context, DifficultySelection difficulty) {
    
    public String cefrLevel() {
        return difficulty.cefrLevel();
    }
    
    public int count() {
        return request.getCount();
    }
    
    /** Round-robin over the modules the context was built from; null for free text. */
    public Long moduleForIndex(int index) {
        if (context.getModuleIds().isEmpty()) {
            return null;
        }
        return context.getModuleIds().get(index % context.getModuleIds().size());
    }
}
