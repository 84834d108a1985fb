package com.edugen.ai.llm.structured;

import com.edugen.ai.provider.ProviderErrorKind;
import com.edugen.ai.provider.ProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Pattern;

/**
 * Helpers for getting a JSON object out of free-form model output.
 */
public final class JsonPayloads {
    
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json|JSON)?\\s*|\\s*```$");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    
    private static final String SCHEMA_INSTRUCTIONS = """
        
        
        Respond with a JSON object that matches this schema:
        ```json
        %s
        ```
        
        Respond ONLY with valid JSON, no additional text.""";
    
    private JsonPayloads() {}
    
    public static String withSchemaInstructions(String prompt, String schemaJson) {
        return prompt + String.format(SCHEMA_INSTRUCTIONS, schemaJson);
    }
    
    /**
     * Parses the first JSON object in {@code content}, repairing the usual defects
     * (code fences, surrounding prose, trailing commas, raw newlines inside strings).
     *
     * @throws ProviderException of kind RESPONSE when no object can be recovered
     */
    public static JsonNode extractObject(ObjectMapper mapper, String content, String provider) {
        if (content == null || content.isBlank()) {
            throw new ProviderException("Empty response from " + provider, ProviderErrorKind.RESPONSE, provider);
        }
        
        String text = stripFences(content.trim());
        JsonNode node = tryParse(mapper, text);
        // readTree stops after the first value, so leading prose like "1 quiz below: {...}" parses as a number
        if (node == null || !node.isObject()) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                String candidate = text.substring(start, end + 1);
                JsonNode extracted = tryParse(mapper, candidate);
                if (extracted == null) {
                    extracted = tryParse(mapper, repair(candidate));
                }
                if (extracted != null) {
                    node = extracted;
                }
            }
        }
        
        if (node == null) {
            throw new ProviderException("Response from " + provider + " is not valid JSON", 
                ProviderErrorKind.RESPONSE, provider);
        }
        if (!node.isObject()) {
            throw new ProviderException("Response from " + provider + " is JSON " + node.getNodeType() 
                + ", expected an object", ProviderErrorKind.RESPONSE, provider);
        }
        return node;
    }
    
    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        return CODE_FENCE.matcher(text).replaceAll("").trim();
    }
    
    static String repair(String json) {
        String withoutCommas = TRAILING_COMMA.matcher(json).replaceAll("$1");
        return escapeNewlinesInStrings(withoutCommas);
    }
    
    private static String escapeNewlinesInStrings(String json) {
        StringBuilder out = new StringBuilder(json.length());
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (escaped) {
                out.append(c);
                escaped = false;
            } else if (c == '\\') {
                out.append(c);
                escaped = true;
            } else if (c == '"') {
                out.append(c);
                inString = !inString;
            } else if (inString && c == '\n') {
                out.append("\\n");
            } else if (inString && c == '\r') {
                out.append("\\r");
            } else if (inString && c == '\t') {
                out.append("\\t");
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
    
    private static JsonNode tryParse(ObjectMapper mapper, String text) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
