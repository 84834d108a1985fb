package com.edugen.ai.llm.structured;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaValidatorTest {
    
    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaValidator validator = new SchemaValidator();
    
    private final JsonSchema question = JsonSchema.object()
        .required("question", JsonSchema.string())
        .required("options", JsonSchema.stringArray().exactly(4))
        .required("correct_index", JsonSchema.integer());
    
    private final JsonSchema schema = JsonSchema.object()
        .required("questions", JsonSchema.arrayOf(question).minItems(1).maxItems(5))
        .optional("title", JsonSchema.string());
    
    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
    
    @Test
    void should_ProduceTypedValues_When_PayloadConforms() throws Exception {
        SchemaValidator.Outcome outcome = validator.validate(json("""
            {"title":"Quiz","questions":[{"question":"Q?","options":["a","b","c","d"],"correct_index":"2"}]}
            """), schema);
        
        assertThat(outcome.isValid()).isTrue();
        StructuredValue.ObjectValue first = outcome.value().array("questions").objects().get(0);
        assertThat(first.get("correct_index").kind()).isEqualTo(StructuredValue.Kind.NUMBER);
        assertThat(first.integer("correct_index")).isEqualTo(2);
        assertThat(first.texts("options")).containsExactly("a", "b", "c", "d");
        assertThat(outcome.value().text("title")).isEqualTo("Quiz");
    }
    
    @Test
    void should_ReportMissingRootKey() throws Exception {
        SchemaValidator.Outcome outcome = validator.validate(json("{\"items\":[]}"), schema);
        
        assertThat(outcome.isValid()).isFalse();
        assertThat(outcome.violations()).containsExactly("missing required field 'questions'");
    }
    
    @Test
    void should_ReportWrongRootType() throws Exception {
        SchemaValidator.Outcome outcome = validator.validate(json("{\"questions\":\"none\"}"), schema);
        
        assertThat(outcome.violations()).singleElement().asString().contains("expected array");
    }
    
    @Test
    void should_ReportCardinalityOutsideBounds() throws Exception {
        assertThat(validator.validate(json("{\"questions\":[]}"), schema).violations())
            .singleElement().asString().contains("at least 1");
        assertThat(validator.validate(json("{\"questions\":[{},{},{},{},{},{}]}"), schema).violations())
            .singleElement().asString().contains("at most 5");
    }
    
    @Test
    @DisplayName("Malformed items below the root are kept for the caller to filter")
    void should_KeepIncompleteItems_When_OnlyItemsAreMalformed() throws Exception {
        SchemaValidator.Outcome outcome = validator.validate(json("""
            {"questions":[{"question":"ok","options":["a","b","c","d"],"correct_index":0},{"options":"broken"}]}
            """), schema);
        
        assertThat(outcome.isValid()).isTrue();
        assertThat(outcome.value().array("questions").size()).isEqualTo(2);
        assertThat(outcome.value().array("questions").objects().get(1).text("question")).isNull();
    }
    
    @Test
    void should_RejectEnumOutsideAllowedValues() throws Exception {
        JsonSchema withEnum = JsonSchema.object().required("level", JsonSchema.string().oneOf("A1", "A2"));
        
        assertThat(validator.validate(json("{\"level\":\"C2\"}"), withEnum).isValid()).isFalse();
        assertThat(validator.validate(json("{\"level\":\"A2\"}"), withEnum).isValid()).isTrue();
    }
    
    @Test
    void should_RejectNonObjectRoot() throws Exception {
        assertThat(validator.validate(json("[1,2]"), schema).violations()).containsExactly("root must be an object");
    }
}
