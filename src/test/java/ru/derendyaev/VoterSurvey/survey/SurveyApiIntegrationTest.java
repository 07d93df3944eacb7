package ru.derendyaev.VoterSurvey.survey;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import ru.derendyaev.VoterSurvey.survey.backup.JsonFileResponseBackup;
import ru.derendyaev.VoterSurvey.survey.repository.SurveyResponseRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SurveyApiIntegrationTest {

    private static Path dataDir;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SurveyResponseRepository repository;

    @Autowired
    private JsonFileResponseBackup backup;

    @DynamicPropertySource
    static void dataProperties(DynamicPropertyRegistry registry) throws IOException {
        dataDir = Files.createTempDirectory("survey-it");
        registry.add("app.values.survey.data-dir", dataDir::toString);
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:survey-it;DB_CLOSE_DELAY=-1");
    }

    @BeforeEach
    void clean() throws IOException {
        repository.deleteAll();
        Files.deleteIfExists(backup.getBackupFile());
    }

    private static String submission(String name, String neighborhood) {
        return """
                {
                  "phoneNumber": "617-555-0100",
                  "name": "%s",
                  "neighborhood": "%s",
                  "ageGroup": "35-44",
                  "votingFrequency": "Every election",
                  "issues": ["Housing", "Public Safety", "Education"],
                  "engagement": "Volunteer"
                }
                """.formatted(name, neighborhood);
    }

    @Test
    void testMissingName_rejectedWithoutSideEffects() throws Exception {
        String payload = """
                {
                  "phoneNumber": "617-555-0100",
                  "neighborhood": "Hyde Park",
                  "ageGroup": "35-44",
                  "votingFrequency": "Every election",
                  "issues": ["Housing"],
                  "engagement": "Volunteer"
                }
                """;

        mockMvc.perform(post("/api/submit-survey").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required field: name"));

        assertThat(repository.count()).isZero();
        assertThat(Files.exists(backup.getBackupFile())).isFalse();
    }

    @Test
    void testEmptyIssues_rejected() throws Exception {
        String payload = submission("Jane", "Hyde Park").replace("[\"Housing\", \"Public Safety\", \"Education\"]", "[]");

        mockMvc.perform(post("/api/submit-survey").contentType(MediaType.APPLICATION_JSON).content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one issue must be selected"));

        assertThat(repository.count()).isZero();
    }

    @Test
    void testSubmit_storesRowAndBackup() throws Exception {
        mockMvc.perform(post("/api/submit-survey").contentType(MediaType.APPLICATION_JSON)
                        .content(submission("Jane", "Hyde Park")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.id").isNumber());

        assertThat(repository.count()).isEqualTo(1);
        assertThat(backup.read()).hasSize(1);
        assertThat(backup.read().get(0)).containsKey("timestamp");

        mockMvc.perform(get("/api/responses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.responses[0].name").value("Jane"))
                .andExpect(jsonPath("$.responses[0].issues[0]").value("Housing"))
                .andExpect(jsonPath("$.responses[0].issues[1]").value("Public Safety"))
                .andExpect(jsonPath("$.responses[0].issues[2]").value("Education"));
    }

    @Test
    void testStats_overThreeSubmissions() throws Exception {
        for (String neighborhood : new String[]{"A", "A", "B"}) {
            mockMvc.perform(post("/api/submit-survey").contentType(MediaType.APPLICATION_JSON)
                            .content(submission("Voter", neighborhood)))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stats.total").value(3))
                .andExpect(jsonPath("$.stats.by_neighborhood.A").value(2))
                .andExpect(jsonPath("$.stats.by_neighborhood.B").value(1))
                .andExpect(jsonPath("$.stats.by_age_group['35-44']").value(3));
    }

    @Test
    void testExportCsv_writesFileUnderDataDirectory() throws Exception {
        mockMvc.perform(post("/api/submit-survey").contentType(MediaType.APPLICATION_JSON)
                        .content(submission("Jane", "Mattapan")))
                .andExpect(status().isOk());

        String body = mockMvc.perform(get("/api/export-csv"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andReturn().getResponse().getContentAsString();

        assertThat(body).contains("responses_export_");
        try (var files = Files.list(dataDir)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .anyMatch(name -> name.matches("responses_export_\\d{8}_\\d{6}\\.csv"));
        }
    }

    @Test
    void testSurveyPage_served() throws Exception {
        mockMvc.perform(get("/survey.html"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(forwardedUrl("/survey.html"));
    }
}
