package ru.derendyaev.VoterSurvey.sms.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.derendyaev.VoterSurvey.sms.model.SendLog;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes {@code {"timestamp": ..., "messages": [...]}} to the log file, replacing any previous run.
 */
@Slf4j
@Component
public class SendLogWriter {

    private final Path logFile;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SendLogWriter(@Value("${app.values.sms.log-file}") String logFile) {
        this.logFile = Path.of(logFile);
    }

    public Path saveLog(SendLog sendLog) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", LocalDateTime.now().toString());
        document.put("messages", sendLog.getMessages());

        mapper.writeValue(logFile.toFile(), document);
        log.info("Log saved to {}", logFile);
        return logFile;
    }
}
