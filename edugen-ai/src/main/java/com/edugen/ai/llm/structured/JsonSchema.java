package com.edugen.ai.llm.structured;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A JSON-schema-like shape describing the object a structured call must return.
 *
 * Built fluently, e.g.
 * <pre>
 * JsonSchema.object()
 *     .required("questions", JsonSchema.arrayOf(question).minItems(1))
 * </pre>
 * The same instance renders the schema text embedded in prompts and drives
 * {@link SchemaValidator}.
 */
public final class JsonSchema {
    
    public enum Type {
        STRING("string"),
        INTEGER("integer"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        ARRAY("array"),
        OBJECT("object");
        
        private final String jsonName;
        
        Type(String jsonName) {
            this.jsonName = jsonName;
        }
        
        public String jsonName() {
            return jsonName;
        }
    }
    
    private final Type type;
    private final Map<String, JsonSchema> properties = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();
    private final List<String> enumValues = new ArrayList<>();
    private JsonSchema items;
    private Integer minItems;
    private Integer maxItems;
    private String description;
    
    private JsonSchema(Type type) {
        this.type = type;
    }
    
    public static JsonSchema object() { return new JsonSchema(Type.OBJECT); }
    public static JsonSchema string() { return new JsonSchema(Type.STRING); }
    public static JsonSchema integer() { return new JsonSchema(Type.INTEGER); }
    public static JsonSchema number() { return new JsonSchema(Type.NUMBER); }
    public static JsonSchema bool() { return new JsonSchema(Type.BOOLEAN); }
    
    public static JsonSchema arrayOf(JsonSchema items) {
        JsonSchema schema = new JsonSchema(Type.ARRAY);
        schema.items = items;
        return schema;
    }
    
    public static JsonSchema stringArray() {
        return arrayOf(string());
    }
    
    public JsonSchema required(String name, JsonSchema schema) {
        requireObject();
        properties.put(name, schema);
        required.add(name);
        return this;
    }
    
    public JsonSchema optional(String name, JsonSchema schema) {
        requireObject();
        properties.put(name, schema);
        return this;
    }
    
    public JsonSchema minItems(int min) {
        this.minItems = min;
        return this;
    }
    
    public JsonSchema maxItems(int max) {
        this.maxItems = max;
        return this;
    }
    
    public JsonSchema exactly(int count) {
        return minItems(count).maxItems(count);
    }
    
    public JsonSchema oneOf(String... values) {
        Collections.addAll(enumValues, values);
        return this;
    }
    
    public JsonSchema describedAs(String text) {
        this.description = text;
        return this;
    }
    
    public Type getType() { return type; }
    public Map<String, JsonSchema> getProperties() { return Collections.unmodifiableMap(properties); }
    public Set<String> getRequired() { return Collections.unmodifiableSet(required); }
    public List<String> getEnumValues() { return Collections.unmodifiableList(enumValues); }
    public JsonSchema getItems() { return items; }
    public Integer getMinItems() { return minItems; }
    public Integer getMaxItems() { return maxItems; }
    public String getDescription() { return description; }
    
    public ObjectNode toNode(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type.jsonName());
        if (description != null) {
            node.put("description", description);
        }
        if (!enumValues.isEmpty()) {
            ArrayNode values = node.putArray("enum");
            enumValues.forEach(values::add);
        }
        if (type == Type.OBJECT) {
            ObjectNode props = node.putObject("properties");
            properties.forEach((name, schema) -> props.set(name, schema.toNode(mapper)));
            if (!required.isEmpty()) {
                ArrayNode req = node.putArray("required");
                required.forEach(req::add);
            }
        }
        if (type == Type.ARRAY) {
            node.set("items", items.toNode(mapper));
            if (minItems != null) node.put("minItems", minItems);
            if (maxItems != null) node.put("maxItems", maxItems);
        }
        return node;
    }
    
    public String toJson(ObjectMapper mapper) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(mapper));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Schema could not be rendered", e);
        }
    }
    
    private void requireObject() {
        if (type != Type.OBJECT) {
            throw new IllegalStateException("Properties are only allowed on object schemas, not " + type);
        }
    }
}
