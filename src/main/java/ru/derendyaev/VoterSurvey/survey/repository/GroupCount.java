package ru.derendyaev.VoterSurvey.survey.repository;

/**
 * Projection for a single {@code GROUP BY} bucket.
 */
public interface GroupCount {

    String getGroupValue();

    Long getGroupCount();
}
