package com.edugen.api.controller;

import com.edugen.core.context.ContextResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Called by the content pipeline after a book is reprocessed.
 */
@RestController
@RequestMapping("/api/v1/ai/books")
@RequiredArgsConstructor
public class BookCacheController {
    
    private final ContextResolver contextResolver;
    
    @PostMapping("/{bookId}/cache/invalidate")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable long bookId) {
        int removed = contextResolver.invalidateBook(bookId);
        return ResponseEntity.ok(Map.of("bookId", bookId, "removed", removed));
    }
}
