package ru.derendyaev.VoterSurvey.sms.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import ru.derendyaev.VoterSurvey.sms.model.Recipient;
import ru.derendyaev.VoterSurvey.sms.model.SendLog;
import ru.derendyaev.VoterSurvey.sms.model.SentMessageRecord;
import ru.derendyaev.VoterSurvey.sms.service.SendLogWriter;
import ru.derendyaev.VoterSurvey.sms.service.SmsInviteService;

import java.io.IOException;
import java.util.List;

/**
 * Runs one invite command. Exit code 1 when a single send fails or the recipients file cannot be read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmsInviteRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final TypeReference<List<Recipient>> RECIPIENTS_TYPE = new TypeReference<>() {};

    private final SmsInviteService smsInviteService;
    private final SendLogWriter sendLogWriter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private int exitCode = 0;

    @Override
    public void run(String... args) {
        InviteCommand command;
        try {
            command = InviteCommand.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Error: {}\n{}", e.getMessage(), InviteCommand.USAGE);
            exitCode = 1;
            return;
        }

        if (command.getMode() == InviteCommand.Mode.BULK) {
            runBulk(command);
        } else {
            runSingle(command);
        }
    }

    private void runBulk(InviteCommand command) {
        List<Recipient> recipients;
        try {
            recipients = objectMapper.readValue(command.getRecipientsFile().toFile(), RECIPIENTS_TYPE);
        } catch (IOException e) {
            log.error("Error: cannot read recipients file {}: {}", command.getRecipientsFile(), e.getMessage());
            exitCode = 1;
            return;
        }

        SendLog sendLog = new SendLog();
        smsInviteService.sendBulk(recipients, sendLog);
        try {
            sendLogWriter.saveLog(sendLog);
        } catch (IOException e) {
            log.error("Error: cannot write SMS log: {}", e.getMessage());
            exitCode = 1;
        }
    }

    private void runSingle(InviteCommand command) {
        SentMessageRecord record = smsInviteService.sendOne(command.getPhone(), command.getName());
        if (record.isSuccess()) {
            log.info("SMS sent successfully!");
        } else {
            log.error("Failed to send SMS");
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
