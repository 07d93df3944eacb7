package ru.derendyaev.VoterSurvey.survey.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ExportResponse {
    private boolean success;
    private String message;
    private String filename;
}
