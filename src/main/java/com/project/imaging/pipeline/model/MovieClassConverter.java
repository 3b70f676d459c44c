package com.project.imaging.pipeline.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MovieClassConverter implements AttributeConverter<MovieClass, String> {

    @Override
    public String convertToDatabaseColumn(MovieClass attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public MovieClass convertToEntityAttribute(String dbData) {
        return dbData == null ? null : MovieClass.fromValue(dbData);
    }
}
