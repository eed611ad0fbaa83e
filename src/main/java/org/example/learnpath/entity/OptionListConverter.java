package org.example.learnpath.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a question's labeled options as a JSON array column.
 */
@Converter
public class OptionListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> OPTION_LIST = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> options) {
        try {
            return MAPPER.writeValueAsString(options == null ? List.of() : options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize question options", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, OPTION_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored question options", e);
        }
    }
}
