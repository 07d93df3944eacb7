package ru.derendyaev.VoterSurvey.survey.service;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionValidatorTest {

    private final SubmissionValidator validator = new SubmissionValidator();

    static Map<String, Object> validPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("phoneNumber", "617-555-0100");
        payload.put("name", "Jane Doe");
        payload.put("neighborhood", "Hyde Park");
        payload.put("ageGroup", "35-44");
        payload.put("votingFrequency", "Every election");
        payload.put("issues", List.of("Housing", "Education"));
        payload.put("engagement", "Volunteer");
        return payload;
    }

    @Test
    void testValidPayload_passes() {
        ValidationResult result = validator.validate(validPayload());

        assertTrue(result.isValid());
        assertNull(result.getKind());
    }

    @Test
    void testMissingName_reportsName() {
        Map<String, Object> payload = validPayload();
        payload.remove("name");

        ValidationResult result = validator.validate(payload);

        assertFalse(result.isValid());
        assertEquals(ViolationKind.MISSING_FIELD, result.getKind());
        assertEquals("name", result.getField());
        assertEquals("Missing required field: name", result.getMessage());
    }

    @Test
    void testEmptyString_countsAsMissing() {
        Map<String, Object> payload = validPayload();
        payload.put("engagement", "");

        ValidationResult result = validator.validate(payload);

        assertEquals("engagement", result.getField());
    }

    @Test
    void testFalse_countsAsMissing() {
        Map<String, Object> payload = validPayload();
        payload.put("name", false);

        ValidationResult result = validator.validate(payload);

        assertEquals(ViolationKind.MISSING_FIELD, result.getKind());
        assertEquals("name", result.getField());
    }

    @Test
    void testZero_countsAsMissing() {
        Map<String, Object> payload = validPayload();
        payload.put("ageGroup", 0);

        assertEquals("ageGroup", validator.validate(payload).getField());
    }

    @Test
    void testNonZeroNumber_isPresent() {
        Map<String, Object> payload = validPayload();
        payload.put("ageGroup", 35);

        assertTrue(validator.validate(payload).isValid());
    }

    @Test
    void testReportsFirstMissingFieldInOrder() {
        Map<String, Object> payload = validPayload();
        payload.remove("votingFrequency");
        payload.remove("phoneNumber");

        assertEquals("phoneNumber", validator.validate(payload).getField());
    }

    @Test
    void testEmptyIssues_isEmptySelection() {
        Map<String, Object> payload = validPayload();
        payload.put("issues", List.of());

        ValidationResult result = validator.validate(payload);

        assertEquals(ViolationKind.EMPTY_SELECTION, result.getKind());
        assertEquals("At least one issue must be selected", result.getMessage());
    }

    @Test
    void testAbsentIssues_isEmptySelection() {
        Map<String, Object> payload = validPayload();
        payload.remove("issues");

        assertEquals(ViolationKind.EMPTY_SELECTION, validator.validate(payload).getKind());
    }

    @Test
    void testIssuesAsString_isEmptySelection() {
        Map<String, Object> payload = validPayload();
        payload.put("issues", "Housing");

        assertEquals(ViolationKind.EMPTY_SELECTION, validator.validate(payload).getKind());
    }

    @Test
    void testRequiredFieldCheckedBeforeIssues() {
        Map<String, Object> payload = validPayload();
        payload.remove("name");
        payload.put("issues", List.of());

        assertEquals(ViolationKind.MISSING_FIELD, validator.validate(payload).getKind());
    }

    @Test
    void testOptionalFieldsNotRequired() {
        Map<String, Object> payload = validPayload();
        payload.remove("email");
        payload.remove("additionalComments");
        payload.remove("timestamp");

        assertTrue(validator.validate(payload).isValid());
    }
}
