package ru.derendyaev.VoterSurvey.survey.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
public class SurveyStats {

    private long total;

    @JsonProperty("by_neighborhood")
    private Map<String, Long> byNeighborhood;

    @JsonProperty("by_age_group")
    private Map<String, Long> byAgeGroup;

    @JsonProperty("by_voting_frequency")
    private Map<String, Long> byVotingFrequency;
}
