package com.edugen.ai.llm.structured;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a parsed payload against a {@link JsonSchema} and converts it into a
 * {@link StructuredValue}.
 *
 * <p>The root object is checked strictly: required keys must be present, every declared
 * root field must have an acceptable type and root arrays must respect their cardinality.
 * Below the root, values are only coerced towards the declared types (numeric strings to
 * numbers and so on); per-item completeness is left to the caller, which can then keep the
 * good items of a partially malformed list.
 */
public class SchemaValidator {
    
    public record Outcome(StructuredValue.ObjectValue value, List<String> violations) {
        public boolean isValid() {
            return violations.isEmpty();
        }
    }
    
    public Outcome validate(JsonNode payload, JsonSchema schema) {
        List<String> violations = new ArrayList<>();
        if (payload == null || !payload.isObject()) {
            violations.add("root must be an object");
            return new Outcome(null, violations);
        }
        
        Map<String, StructuredValue> fields = new LinkedHashMap<>();
        for (String name : schema.getRequired()) {
            JsonNode node = payload.get(name);
            if (node == null || node.isNull()) {
                violations.add("missing required field '" + name + "'");
            }
        }
        
        Iterator<Map.Entry<String, JsonNode>> it = payload.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey();
            JsonNode node = field.getValue();
            JsonSchema fieldSchema = schema.getProperties().get(name);
            
            if (fieldSchema == null || node.isNull()) {
                fields.put(name, StructuredValue.fromJson(node));
                continue;
            }
            
            StructuredValue value = coerce(node, fieldSchema);
            if (value == null) {
                violations.add("field '" + name + "' expected " + fieldSchema.getType().jsonName() 
                    + " but was " + node.getNodeType().name().toLowerCase());
                continue;
            }
            checkCardinality(name, fieldSchema, value, violations);
            checkEnum(name, fieldSchema, value, violations);
            fields.put(name, value);
        }
        
        return new Outcome(violations.isEmpty() ? new StructuredValue.ObjectValue(fields) : null, violations);
    }
    
    private void checkCardinality(String name, JsonSchema schema, StructuredValue value, List<String> violations) {
        if (value.kind() != StructuredValue.Kind.ARRAY) {
            return;
        }
        int size = ((StructuredValue.ArrayValue) value).size();
        if (schema.getMinItems() != null && size < schema.getMinItems()) {
            violations.add("field '" + name + "' has " + size + " items, at least " + schema.getMinItems() + " required");
        }
        if (schema.getMaxItems() != null && size > schema.getMaxItems()) {
            violations.add("field '" + name + "' has " + size + " items, at most " + schema.getMaxItems() + " allowed");
        }
    }
    
    private void checkEnum(String name, JsonSchema schema, StructuredValue value, List<String> violations) {
        if (schema.getEnumValues().isEmpty() || value.asText() == null) {
            return;
        }
        if (!schema.getEnumValues().contains(value.asText())) {
            violations.add("field '" + name + "' value '" + value.asText() + "' not in " + schema.getEnumValues());
        }
    }
    
    /**
     * Converts {@code node} to the declared type, or returns null when it cannot be.
     */
    static StructuredValue coerce(JsonNode node, JsonSchema schema) {
        switch (schema.getType()) {
            case STRING:
                if (node.isTextual() || node.isNumber() || node.isBoolean()) {
                    return new StructuredValue.StringValue(node.asText());
                }
                return null;
            case INTEGER:
            case NUMBER:
                if (node.isNumber()) {
                    return new StructuredValue.NumberValue(node.decimalValue());
                }
                if (node.isTextual()) {
                    try {
                        return new StructuredValue.NumberValue(new BigDecimal(node.asText().trim()));
                    } catch (NumberFormatException e) {
                        return null;
                    }
                }
                return null;
            case BOOLEAN:
                if (node.isBoolean()) {
                    return new StructuredValue.BooleanValue(node.asBoolean());
                }
                if (node.isTextual() && ("true".equalsIgnoreCase(node.asText()) || "false".equalsIgnoreCase(node.asText()))) {
                    return new StructuredValue.BooleanValue(Boolean.parseBoolean(node.asText().toLowerCase()));
                }
                return null;
            case ARRAY:
                if (!node.isArray()) {
                    return null;
                }
                List<StructuredValue> elements = new ArrayList<>(node.size());
                node.forEach(element -> elements.add(lenient(element, schema.getItems())));
                return new StructuredValue.ArrayValue(elements);
            case OBJECT:
                if (!node.isObject()) {
                    return null;
                }
                Map<String, StructuredValue> fields = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> field = it.next();
                    JsonSchema fieldSchema = schema.getProperties().get(field.getKey());
                    fields.put(field.getKey(), lenient(field.getValue(), fieldSchema));
                }
                return new StructuredValue.ObjectValue(fields);
            default:
                return null;
        }
    }
    
    private static StructuredValue lenient(JsonNode node, JsonSchema schema) {
        if (schema == null || node == null || node.isNull()) {
            return StructuredValue.fromJson(node);
        }
        StructuredValue value = coerce(node, schema);
        return value != null ? value : StructuredValue.fromJson(node);
    }
}
