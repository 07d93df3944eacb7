package ru.derendyaev.VoterSurvey.survey.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of checking a submission payload: either valid, or the first constraint it broke.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null, null, null);

    private final ViolationKind kind;
    private final String field;
    private final String message;

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult missingField(String field) {
        return new ValidationResult(ViolationKind.MISSING_FIELD, field, "Missing required field: " + field);
    }

    public static ValidationResult emptySelection() {
        return new ValidationResult(ViolationKind.EMPTY_SELECTION, SubmissionValidator.ISSUES,
                "At least one issue must be selected");
    }

    public boolean isValid() {
        return kind == null;
    }
}
