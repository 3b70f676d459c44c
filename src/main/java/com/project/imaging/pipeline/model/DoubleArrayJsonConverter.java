package com.project.imaging.pipeline.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores a {@code double[]} as a JSON array in a text column. */
@Converter
public class DoubleArrayJsonConverter implements AttributeConverter<double[], String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(double[] attribute) {
        if (attribute == null) return null;
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode double array", e);
        }
    }

    @Override
    public double[] convertToEntityAttribute(String dbData) {
        if (dbData == null) return null;
        try {
            return MAPPER.readValue(dbData, double[].class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Column does not hold a JSON number array: " + IntArrayJsonConverter.abbreviate(dbData), e);
        }
    }
}
