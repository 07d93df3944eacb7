package ru.derendyaev.VoterSurvey.survey.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import ru.derendyaev.VoterSurvey.survey.model.SurveyStats;

@Data
@AllArgsConstructor
public class StatsResponse {
    private boolean success;
    private SurveyStats stats;
}
