package com.edugen.api.exception;

import com.edugen.ai.provider.AllProvidersFailedException;
import com.edugen.ai.provider.ProviderException;
import com.edugen.ai.provider.ProviderUnavailableException;
import com.edugen.ai.ratelimit.RateLimitExceededException;
import com.edugen.api.dto.response.ErrorResponse;
import com.edugen.core.activity.ActivityNotFoundException;
import com.edugen.core.context.ContextResolutionException;
import com.edugen.core.context.SourceNotFoundException;
import com.edugen.core.generation.GenerationException;
import com.edugen.core.generation.InvalidGenerationRequestException;
import com.edugen.core.generation.NoValidItemsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.append(fieldName).append(": ").append(errorMessage).append("; ");
            fields.put(fieldName, errorMessage);
        });
        
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request, 
            Map.of("fields", fields));
    }
    
    @ExceptionHandler(InvalidGenerationRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            InvalidGenerationRequestException ex,
            WebRequest request
    ) {
        log.warn("Invalid generation request | field={} | message={}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid generation request", ex.getMessage(), request,
            Map.of("field", ex.getField()));
    }
    
    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class,
        IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            WebRequest request
    ) {
        return respond(HttpStatus.BAD_REQUEST, "Bad request", ex.getMessage(), request, null);
    }
    
    @ExceptionHandler(SourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSourceNotFound(
            SourceNotFoundException ex,
            WebRequest request
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("book_id", ex.getBookId());
        details.put("module_ids", ex.getModuleIds());
        return respond(HttpStatus.NOT_FOUND, "Source not found", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(ActivityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleActivityNotFound(
            ActivityNotFoundException ex,
            WebRequest request
    ) {
        return respond(HttpStatus.NOT_FOUND, "Activity not found", ex.getMessage(), request,
            Map.of("activity_id", ex.getActivityId()));
    }
    
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(
            RateLimitExceededException ex,
            WebRequest request
    ) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit_type", ex.getLimitType().name());
        details.put("current_usage", ex.getCurrentUsage());
        details.put("max_allowed", ex.getMaxAllowed());
        if (ex.getResetAt() != null) {
            details.put("reset_at", ex.getResetAt().toString());
        }
        
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getResetAt() != null) {
            long seconds = Math.max(1, Duration.between(Instant.now(), ex.getResetAt()).getSeconds());
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return builder.body(body(HttpStatus.TOO_MANY_REQUESTS, "Generation quota exceeded", 
            ex.getMessage(), request, details));
    }
    
    @ExceptionHandler(NoValidItemsException.class)
    public ResponseEntity<ErrorResponse> handleNoValidItems(
            NoValidItemsException ex,
            WebRequest request
    ) {
        log.warn("No valid items | type={} | candidates={}", ex.getActivityType().slug(), ex.getCandidateCount());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("activity_type", ex.getActivityType().slug());
        details.put("candidates", ex.getCandidateCount());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "No usable items generated", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> handleGeneration(
            GenerationException ex,
            WebRequest request
    ) {
        log.error("Generation failed | type={} | providers={} | attempts={}", 
            ex.getActivityType() != null ? ex.getActivityType().slug() : null, 
            ex.getAttemptedProviders(), ex.getTotalAttempts());
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getActivityType() != null) {
            details.put("activity_type", ex.getActivityType().slug());
        }
        details.put("attempted_providers", ex.getAttemptedProviders());
        details.put("total_attempts", ex.getTotalAttempts());
        return respond(HttpStatus.BAD_GATEWAY, "Generation failed", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(AllProvidersFailedException.class)
    public ResponseEntity<ErrorResponse> handleAllProvidersFailed(
            AllProvidersFailedException ex,
            WebRequest request
    ) {
        log.error("All providers failed | providers={} | attempts={}", 
            ex.getAttemptedProviders(), ex.getTotalAttempts());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempted_providers", ex.getAttemptedProviders());
        details.put("total_attempts", ex.getTotalAttempts());
        return respond(HttpStatus.BAD_GATEWAY, "All providers failed", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponse> handleProvider(
            ProviderException ex,
            WebRequest request
    ) {
        log.error("Provider error | provider={} | kind={} | message={}", ex.getProvider(), ex.getKind(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("provider", ex.getProvider());
        details.put("kind", ex.getKind().name());
        return respond(HttpStatus.BAD_GATEWAY, "Provider error", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(ContextResolutionException.class)
    public ResponseEntity<ErrorResponse> handleContextResolution(
            ContextResolutionException ex,
            WebRequest request
    ) {
        log.error("Context resolution failed | bookId={} | reason={} | message={}", 
            ex.getBookId(), ex.getReason(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("book_id", ex.getBookId());
        details.put("reason", ex.getReason().name());
        return respond(HttpStatus.BAD_GATEWAY, "Content could not be loaded", ex.getMessage(), request, details);
    }
    
    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProviderUnavailable(
            ProviderUnavailableException ex,
            WebRequest request
    ) {
        log.error("AI generation unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "AI generation unavailable", ex.getMessage(), request, null);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request, null);
    }
    
    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String error,
                                                         WebRequest request, Map<String, Object> details) {
        return ResponseEntity.status(status).body(body(status, message, error, request, details));
    }
    
    private static ErrorResponse body(HttpStatus status, String message, String error,
                                      WebRequest request, Map<String, Object> details) {
        return ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .details(details)
            .build();
    }
}
