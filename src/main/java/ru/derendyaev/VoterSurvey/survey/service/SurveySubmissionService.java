package ru.derendyaev.VoterSurvey.survey.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.derendyaev.VoterSurvey.survey.backup.ResponseBackup;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static ru.derendyaev.VoterSurvey.survey.service.SubmissionValidator.*;

/**
 * Validate, store, then back up a submission. A failed insert never reaches the backup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveySubmissionService {

    private final SubmissionValidator validator;
    private final SurveyResponseService responseService;
    private final ResponseBackup backup;
    private final Clock clock;

    public SubmissionResult submit(Map<String, Object> payload) {
        ValidationResult validation = validator.validate(payload);
        if (!validation.isValid()) {
            log.info("Rejected survey submission: {}", validation.getMessage());
            return SubmissionResult.rejected(validation);
        }

        Object timestamp = payload.get(TIMESTAMP);
        if (timestamp == null || timestamp.toString().isEmpty()) {
            payload.put(TIMESTAMP, LocalDateTime.now(clock).toString());
        }

        Long id = responseService.insert(toEntity(payload));
        backup.append(payload);

        log.info("Survey response saved (ID: {}) from {}", id, payload.get(NAME));
        return SubmissionResult.accepted(id);
    }

    static SurveyResponseEntity toEntity(Map<String, Object> payload) {
        return SurveyResponseEntity.builder()
                .phoneNumber(text(payload, PHONE_NUMBER))
                .name(text(payload, NAME))
                .email(text(payload, EMAIL))
                .neighborhood(text(payload, NEIGHBORHOOD))
                .ageGroup(text(payload, AGE_GROUP))
                .votingFrequency(text(payload, VOTING_FREQUENCY))
                .issues(issues(payload))
                .engagement(text(payload, ENGAGEMENT))
                .additionalComments(text(payload, ADDITIONAL_COMMENTS))
                .timestamp(text(payload, TIMESTAMP))
                .build();
    }

    private static String text(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        return value == null ? "" : value.toString();
    }

    private static List<String> issues(Map<String, Object> payload) {
        List<String> issues = new ArrayList<>();
        for (Object issue : (Collection<?>) payload.get(ISSUES)) {
            issues.add(String.valueOf(issue));
        }
        return issues;
    }
}
