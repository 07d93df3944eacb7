package ru.derendyaev.VoterSurvey.survey.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the ordered issue selection as a JSON array in a single text column.
 */
@Converter
public class IssuesConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ISSUES_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> issues) {
        try {
            return MAPPER.writeValueAsString(issues == null ? List.of() : issues);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise issues: " + issues, e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(column, ISSUES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored issues are not a JSON array: " + column, e);
        }
    }
}
