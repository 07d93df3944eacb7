package ru.derendyaev.VoterSurvey.survey.service;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks a raw submission payload. No side effects.
 */
@Component
public class SubmissionValidator {

    public static final String PHONE_NUMBER = "phoneNumber";
    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String NEIGHBORHOOD = "neighborhood";
    public static final String AGE_GROUP = "ageGroup";
    public static final String VOTING_FREQUENCY = "votingFrequency";
    public static final String ISSUES = "issues";
    public static final String ENGAGEMENT = "engagement";
    public static final String ADDITIONAL_COMMENTS = "additionalComments";
    public static final String TIMESTAMP = "timestamp";

    /** Checked in this order; the first empty one is reported. */
    static final List<String> REQUIRED_FIELDS = List.of(
            PHONE_NUMBER, NAME, NEIGHBORHOOD, AGE_GROUP, VOTING_FREQUENCY, ENGAGEMENT);

    public ValidationResult validate(Map<String, Object> payload) {
        if (payload == null) {
            return ValidationResult.missingField(PHONE_NUMBER);
        }

        for (String field : REQUIRED_FIELDS) {
            if (isEmpty(payload.get(field))) {
                return ValidationResult.missingField(field);
            }
        }

        // a bare string is not a selection
        Object issues = payload.get(ISSUES);
        if (!(issues instanceof Collection<?> selection) || selection.isEmpty()) {
            return ValidationResult.emptySelection();
        }

        return ValidationResult.valid();
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence text) return text.length() == 0;
        if (value instanceof Collection<?> collection) return collection.isEmpty();
        if (value instanceof Map<?, ?> map) return map.isEmpty();
        if (value instanceof Boolean flag) return !flag;
        if (value instanceof Number number) return number.doubleValue() == 0;
        return false;
    }
}
