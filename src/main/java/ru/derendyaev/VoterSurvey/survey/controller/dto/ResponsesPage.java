package ru.derendyaev.VoterSurvey.survey.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;

import java.util.List;

@Data
@AllArgsConstructor
public class ResponsesPage {
    private boolean success;
    private int count;
    private List<SurveyResponseEntity> responses;
}
