package ru.derendyaev.VoterSurvey.survey.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SubmissionResult {

    private final Long id;
    private final ValidationResult validation;

    public static SubmissionResult accepted(Long id) {
        return new SubmissionResult(id, ValidationResult.valid());
    }

    public static SubmissionResult rejected(ValidationResult validation) {
        return new SubmissionResult(null, validation);
    }

    public boolean isAccepted() {
        return validation.isValid();
    }
}
