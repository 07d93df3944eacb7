package ru.derendyaev.VoterSurvey.survey.backup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import ru.derendyaev.VoterSurvey.survey.exception.BackupWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code responses.json} in the data directory as a JSON array of submitted payloads.
 * Each append reads the whole document and rewrites it.
 */
@Slf4j
@Component
public class JsonFileResponseBackup implements ResponseBackup {

    public static final String BACKUP_FILE_NAME = "responses.json";

    private static final TypeReference<List<Map<String, Object>>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final Path backupFile;
    private final ObjectMapper mapper;

    public JsonFileResponseBackup(@Qualifier("surveyDataDir") Path dataDir) {
        this.backupFile = dataDir.resolve(BACKUP_FILE_NAME);
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void append(Map<String, Object> payload) {
        try {
            List<Map<String, Object>> responses = read();
            responses.add(payload);
            mapper.writeValue(backupFile.toFile(), responses);
            log.debug("Backup now holds {} responses", responses.size());
        } catch (IOException e) {
            log.error("Failed to write backup {}: {}", backupFile, e.getMessage());
            throw new BackupWriteException("Failed to write backup " + backupFile + ": " + e.getMessage(), e);
        }
    }

    public List<Map<String, Object>> read() throws IOException {
        if (!Files.exists(backupFile)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(mapper.readValue(backupFile.toFile(), DOCUMENT_TYPE));
    }

    public Path getBackupFile() {
        return backupFile;
    }
}
