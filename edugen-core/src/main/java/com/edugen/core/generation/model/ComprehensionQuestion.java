package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComprehensionQuestion extends ActivityItem {
    
    public static final String MCQ = "mcq";
    public static final String TRUE_FALSE = "true_false";
    public static final String SHORT_ANSWER = "short_answer";
    
    private String questionType;
    private String question;
    /** Null for short answers. */
    private List<String> options;
    private Integer correctIndex;
    private String correctAnswer;
    private String explanation;
    private String passageReference;
}
