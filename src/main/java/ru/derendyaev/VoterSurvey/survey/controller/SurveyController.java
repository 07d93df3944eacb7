package ru.derendyaev.VoterSurvey.survey.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.derendyaev.VoterSurvey.survey.controller.dto.*;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;
import ru.derendyaev.VoterSurvey.survey.service.CsvExportService;
import ru.derendyaev.VoterSurvey.survey.service.SubmissionResult;
import ru.derendyaev.VoterSurvey.survey.service.SurveyResponseService;
import ru.derendyaev.VoterSurvey.survey.service.SurveySubmissionService;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SurveyController {

    private final SurveySubmissionService submissionService;
    private final SurveyResponseService responseService;
    private final CsvExportService csvExportService;

    /**
     * POST /api/submit-survey
     * 400 with the first violated constraint, 500 with the raw exception text on any failure.
     */
    @PostMapping("/submit-survey")
    public ResponseEntity<?> submitSurvey(@RequestBody Map<String, Object> payload) {
        try {
            SubmissionResult result = submissionService.submit(payload);
            if (!result.isAccepted()) {
                return ResponseEntity.badRequest().body(ApiError.of(result.getValidation().getMessage()));
            }
            return ResponseEntity.ok(new SubmitResponse(true, "Survey response saved successfully", result.getId()));
        } catch (Exception e) {
            log.error("Error saving survey response: {}", e.getMessage(), e);
            return failure("Failed to save survey response", e);
        }
    }

    /**
     * GET /api/responses
     * Newest first, issues restored to arrays.
     */
    @GetMapping("/responses")
    public ResponseEntity<?> getResponses() {
        try {
            List<SurveyResponseEntity> responses = responseService.listAll();
            return ResponseEntity.ok(new ResponsesPage(true, responses.size(), responses));
        } catch (Exception e) {
            log.error("Error fetching responses: {}", e.getMessage(), e);
            return failure("Failed to fetch responses", e);
        }
    }

    @GetMapping("/export-csv")
    public ResponseEntity<?> exportCsv() {
        try {
            String filename = csvExportService.export();
            return ResponseEntity.ok(new ExportResponse(true, "CSV exported successfully", filename));
        } catch (Exception e) {
            log.error("Error exporting CSV: {}", e.getMessage(), e);
            return failure("Failed to export CSV", e);
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            return ResponseEntity.ok(new StatsResponse(true, responseService.stats()));
        } catch (Exception e) {
            log.error("Error fetching stats: {}", e.getMessage(), e);
            return failure("Failed to fetch statistics", e);
        }
    }

    private static ResponseEntity<ApiError> failure(String error, Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(error, e.getMessage()));
    }
}
