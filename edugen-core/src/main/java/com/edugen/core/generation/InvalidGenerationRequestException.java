package com.edugen.core.generation;

import lombok.Getter;

@Getter
public class InvalidGenerationRequestException extends RuntimeException {
    
    private final String field;
    
    public InvalidGenerationRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
