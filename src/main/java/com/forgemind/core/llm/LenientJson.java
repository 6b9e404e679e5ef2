package com.forgemind.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forgiving JSON parsing for model output: strips markdown fences, ignores unknown
 * properties and tolerates single values where arrays are expected.
 */
public final class LenientJson {

    private static final Logger log = LoggerFactory.getLogger(LenientJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private LenientJson() {}

    public static <T> T parse(String json, Class<T> outputType) {
        if (json == null || json.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        String cleaned = stripFences(json);
        try {
            return MAPPER.readValue(cleaned, outputType);
        } catch (Exception e) {
            log.error("Lenient JSON parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", json);
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    public static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        // Models sometimes wrap the object in prose
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start > 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }
}
