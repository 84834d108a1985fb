package com.edugen.ai.llm.structured;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema-checked value produced by structured generation. Every node carries a
 * {@link Kind} tag so generation services read typed values instead of raw maps.
 */
public abstract class StructuredValue {
    
    public enum Kind { STRING, NUMBER, BOOLEAN, ARRAY, OBJECT, NULL }
    
    private StructuredValue() {}
    
    public abstract Kind kind();
    
    public boolean isNull() {
        return kind() == Kind.NULL;
    }
    
    /**
     * Text form of scalars; null for arrays, objects and nulls.
     */
    public String asText() {
        return null;
    }
    
    /**
     * Untyped conversion without any schema, used for fields the schema leaves open.
     */
    public static StructuredValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new StringValue(node.asText());
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.asBoolean());
        }
        if (node.isArray()) {
            List<StructuredValue> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(fromJson(element)));
            return new ArrayValue(elements);
        }
        Map<String, StructuredValue> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), fromJson(field.getValue()));
        }
        return new ObjectValue(fields);
    }
    
    public static final class StringValue extends StructuredValue {
        private final String value;
        
        public StringValue(String value) {
            this.value = value;
        }
        
        @Override public Kind kind() { return Kind.STRING; }
        @Override public String asText() { return value; }
        public String value() { return value; }
        @Override public String toString() { return '"' + value + '"'; }
    }
    
    public static final class NumberValue extends StructuredValue {
        private final BigDecimal value;
        
        public NumberValue(BigDecimal value) {
            this.value = value;
        }
        
        @Override public Kind kind() { return Kind.NUMBER; }
        @Override public String asText() { return value.stripTrailingZeros().toPlainString(); }
        public BigDecimal value() { return value; }
        public int intValue() { return value.intValue(); }
        @Override public String toString() { return asText(); }
    }
    
    public static final class BooleanValue extends StructuredValue {
        private final boolean value;
        
        public BooleanValue(boolean value) {
            this.value = value;
        }
        
        @Override public Kind kind() { return Kind.BOOLEAN; }
        @Override public String asText() { return Boolean.toString(value); }
        public boolean value() { return value; }
        @Override public String toString() { return asText(); }
    }
    
    public static final class NullValue extends StructuredValue {
        public static final NullValue INSTANCE = new NullValue();
        
        private NullValue() {}
        
        @Override public Kind kind() { return Kind.NULL; }
        @Override public String toString() { return "null"; }
    }
    
    public static final class ArrayValue extends StructuredValue {
        private final List<StructuredValue> elements;
        
        public ArrayValue(List<StructuredValue> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
        
        @Override public Kind kind() { return Kind.ARRAY; }
        public List<StructuredValue> elements() { return elements; }
        public int size() { return elements.size(); }
        
        public List<ObjectValue> objects() {
            List<ObjectValue> result = new ArrayList<>();
            for (StructuredValue element : elements) {
                if (element.kind() == Kind.OBJECT) {
                    result.add((ObjectValue) element);
                }
            }
            return result;
        }
        
        public List<String> texts() {
            List<String> result = new ArrayList<>();
            for (StructuredValue element : elements) {
                String text = element.asText();
                if (text != null) {
                    result.add(text);
                }
            }
            return result;
        }
        
        @Override public String toString() { return elements.toString(); }
    }
    
    public static final class ObjectValue extends StructuredValue {
        private final Map<String, StructuredValue> fields;
        
        public ObjectValue(Map<String, StructuredValue> fields) {
            this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
        
        @Override public Kind kind() { return Kind.OBJECT; }
        public Map<String, StructuredValue> fields() { return fields; }
        
        public boolean has(String name) {
            StructuredValue value = fields.get(name);
            return value != null && !value.isNull();
        }
        
        public StructuredValue get(String name) {
            return fields.getOrDefault(name, NullValue.INSTANCE);
        }
        
        /**
         * Trimmed text of a scalar field, or null when absent or blank.
         */
        public String text(String name) {
            String text = get(name).asText();
            if (text == null) {
                return null;
            }
            String trimmed = text.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        
        public String text(String name, String fallback) {
            String text = text(name);
            return text != null ? text : fallback;
        }
        
        public Integer integer(String name) {
            StructuredValue value = get(name);
            if (value.kind() == Kind.NUMBER) {
                return ((NumberValue) value).intValue();
            }
            if (value.kind() == Kind.STRING) {
                try {
                    return Integer.parseInt(((StringValue) value).value().trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
        
        public int integer(String name, int fallback) {
            Integer value = integer(name);
            return value != null ? value : fallback;
        }
        
        public ArrayValue array(String name) {
            StructuredValue value = get(name);
            return value.kind() == Kind.ARRAY ? (ArrayValue) value : new ArrayValue(List.of());
        }
        
        public ObjectValue object(String name) {
            StructuredValue value = get(name);
            return value.kind() == Kind.OBJECT ? (ObjectValue) value : null;
        }
        
        /**
         * Non-blank trimmed strings of an array field, skipping non-scalars.
         */
        public List<String> texts(String name) {
            List<String> result = new ArrayList<>();
            for (String text : array(name).texts()) {
                if (!text.isBlank()) {
                    result.add(text.trim());
                }
            }
            return result;
        }
        
        @Override public String toString() { return fields.toString(); }
    }
}
