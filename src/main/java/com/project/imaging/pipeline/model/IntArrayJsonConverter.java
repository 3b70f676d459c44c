package com.project.imaging.pipeline.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores an {@code int[]} as a JSON array in a text column. */
@Converter
public class IntArrayJsonConverter implements AttributeConverter<int[], String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(int[] attribute) {
        if (attribute == null) return null;
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode int array", e);
        }
    }

    @Override
    public int[] convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        try {
            return MAPPER.readValue(dbData, int[].class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Column does not hold a JSON int array: " + abbreviate(dbData), e);
        }
    }

    static String abbreviate(String s) {
        return s.length() <= 64 ? s : s.substring(0, 61) + "...";
    }
}
