package com.platform.datakeeper.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;

/**
 * Write-time check for JSON columns: rows are only written with well-formed JSON
 * of the expected shape.
 */
public final class JsonColumns {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    
    private JsonColumns() {
    }
    
    public static void requireArray(String column, String json) {
        if (!parse(column, json).isArray()) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, column, json, column + " must be a JSON array");
        }
    }
    
    public static void requireObject(String column, String json) {
        if (!parse(column, json).isObject()) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, column, json, column + " must be a JSON object");
        }
    }
    
    private static JsonNode parse(String column, String json) {
        if (json == null) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, column, null, column + " must not be null");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, column, json,
                column + " is not well-formed JSON: " + e.getOriginalMessage());
        }
    }
}
