package com.edugen.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit row, one per provider attempt.
 */
@Entity
@Table(name = "ai_usage_log", indexes = {
    @Index(name = "idx_ai_usage_teacher_created", columnList = "teacher_id, created_at"),
    @Index(name = "idx_ai_usage_provider_created", columnList = "provider, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AiUsageLog {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(name = "request_id", nullable = false, length = 64)
    private String requestId;
    
    @Column(name = "teacher_id", length = 64)
    private String teacherId;
    
    // LLM_GENERATION or TTS_SYNTHESIS
    @Column(name = "operation_type", nullable = false, length = 32)
    private String operationType;
    
    @Column(name = "activity_type", length = 64)
    private String activityType;
    
    @Column(name = "provider", nullable = false, length = 32)
    private String provider;
    
    @Column(name = "model", length = 100)
    private String model;
    
    @Column(name = "prompt_hash", length = 16)
    private String promptHash;
    
    @Column(name = "prompt_length")
    @Builder.Default
    private Integer promptLength = 0;
    
    @Column(name = "input_tokens")
    @Builder.Default
    private Integer inputTokens = 0;
    
    @Column(name = "output_tokens")
    @Builder.Default
    private Integer outputTokens = 0;
    
    @Column(name = "audio_characters")
    @Builder.Default
    private Integer audioCharacters = 0;
    
    @Column(name = "estimated_cost", nullable = false)
    @Builder.Default
    private Double estimatedCost = 0.0;
    
    @Column(name = "success", nullable = false)
    private Boolean success;
    
    @Column(name = "error_type", length = 32)
    private String errorType;
    
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
    
    @Column(name = "duration_ms")
    private Long durationMs;
    
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
