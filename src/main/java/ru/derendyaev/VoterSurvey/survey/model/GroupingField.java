package ru.derendyaev.VoterSurvey.survey.model;

/**
 * Columns the stats endpoint breaks responses down by.
 */
public enum GroupingField {
    NEIGHBORHOOD("by_neighborhood"),
    AGE_GROUP("by_age_group"),
    VOTING_FREQUENCY("by_voting_frequency");

    private final String statsKey;

    GroupingField(String statsKey) {
        this.statsKey = statsKey;
    }

    public String getStatsKey() {
        return statsKey;
    }
}
