package ru.derendyaev.VoterSurvey.sms.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.derendyaev.VoterSurvey.sms.model.SendLog;
import ru.derendyaev.VoterSurvey.sms.model.SentMessageRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SendLogWriterTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSaveLog_writesTimestampAndMessages() throws IOException {
        Path logFile = dir.resolve("sms_log.json");
        SendLog sendLog = new SendLog();
        sendLog.add(SentMessageRecord.builder().success(true).to("+16175550100").sid("SM1").status("queued")
                .timestamp("2024-10-01T10:00:00").build());
        sendLog.add(SentMessageRecord.builder().success(false).to("555").error("invalid number")
                .timestamp("2024-10-01T10:00:01").name("Jane").build());

        new SendLogWriter(logFile.toString()).saveLog(sendLog);

        JsonNode document = mapper.readTree(logFile.toFile());
        assertTrue(document.hasNonNull("timestamp"));
        assertEquals(2, document.get("messages").size());
        assertEquals("SM1", document.get("messages").get(0).get("sid").asText());
        assertEquals("invalid number", document.get("messages").get(1).get("error").asText());
        assertFalse(document.get("messages").get(1).get("success").asBoolean());
    }

    @Test
    void testSaveLog_overwritesPreviousRun() throws IOException {
        Path logFile = dir.resolve("sms_log.json");
        Files.writeString(logFile, "{\"messages\":[1,2,3,4,5]}");

        new SendLogWriter(logFile.toString()).saveLog(new SendLog());

        assertEquals(0, mapper.readTree(logFile.toFile()).get("messages").size());
    }
}
