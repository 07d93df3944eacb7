package ru.derendyaev.VoterSurvey.survey.service;

public enum ViolationKind {
    MISSING_FIELD,
    EMPTY_SELECTION
}
