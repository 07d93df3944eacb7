package ru.derendyaev.VoterSurvey.survey.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    private String error;
    private String details;

    public static ApiError of(String error) {
        return new ApiError(error, null);
    }
}
