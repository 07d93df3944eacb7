package ru.derendyaev.VoterSurvey.survey.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.derendyaev.VoterSurvey.survey.exception.CsvExportException;
import ru.derendyaev.VoterSurvey.survey.model.IssuesConverter;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dumps the whole store to {@code responses_export_<yyyyMMdd_HHmmss>.csv} in the data directory.
 * An empty store produces a file with only the header row.
 */
@Slf4j
@Service
public class CsvExportService {

    public static final List<String> COLUMNS = List.of(
            "id", "phone_number", "name", "email", "neighborhood", "age_group",
            "voting_frequency", "issues", "engagement", "additional_comments", "timestamp");

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SurveyResponseService responseService;
    private final Path dataDir;
    private final Clock clock;
    private final CsvMapper csvMapper = new CsvMapper();
    private final IssuesConverter issuesConverter = new IssuesConverter();

    public CsvExportService(SurveyResponseService responseService,
                            @Qualifier("surveyDataDir") Path dataDir,
                            Clock clock) {
        this.responseService = responseService;
        this.dataDir = dataDir;
        this.clock = clock;
    }

    /**
     * @return path of the written file
     */
    public String export() {
        List<SurveyResponseEntity> rows = responseService.listAll();
        Path csvFile = dataDir.resolve("responses_export_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".csv");

        CsvSchema.Builder schema = CsvSchema.builder();
        COLUMNS.forEach(schema::addColumn);

        try (SequenceWriter writer = csvMapper.writer(schema.build()).writeValues(csvFile.toFile())) {
            // header written as a row so it is present even without data rows
            Map<String, Object> header = new LinkedHashMap<>();
            COLUMNS.forEach(column -> header.put(column, column));
            writer.write(header);

            for (SurveyResponseEntity row : rows) {
                writer.write(toRecord(row));
            }
        } catch (IOException e) {
            log.error("Failed to export CSV to {}: {}", csvFile, e.getMessage());
            throw new CsvExportException("Failed to write " + csvFile + ": " + e.getMessage(), e);
        }

        log.info("Exported {} survey responses to {}", rows.size(), csvFile);
        return csvFile.toString();
    }

    private Map<String, Object> toRecord(SurveyResponseEntity row) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", row.getId());
        record.put("phone_number", row.getPhoneNumber());
        record.put("name", row.getName());
        record.put("email", row.getEmail());
        record.put("neighborhood", row.getNeighborhood());
        record.put("age_group", row.getAgeGroup());
        record.put("voting_frequency", row.getVotingFrequency());
        record.put("issues", issuesConverter.convertToDatabaseColumn(row.getIssues()));
        record.put("engagement", row.getEngagement());
        record.put("additional_comments", row.getAdditionalComments());
        record.put("timestamp", row.getTimestamp());
        return record;
    }
}
