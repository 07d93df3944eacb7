package ru.derendyaev.VoterSurvey.sms.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.derendyaev.VoterSurvey.sms.model.BulkSendSummary;
import ru.derendyaev.VoterSurvey.sms.model.Recipient;
import ru.derendyaev.VoterSurvey.sms.model.SendLog;
import ru.derendyaev.VoterSurvey.sms.model.SentMessageRecord;
import ru.derendyaev.VoterSurvey.sms.twilio.MessagingProvider;
import ru.derendyaev.VoterSurvey.sms.twilio.MessagingProviderException;
import ru.derendyaev.VoterSurvey.sms.twilio.dto.MessageResponse;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class SmsInviteService {

    private static final String SEPARATOR = "=".repeat(50);

    private final MessagingProvider messagingProvider;
    private final String surveyUrl;

    public SmsInviteService(MessagingProvider messagingProvider,
                            @Value("${app.values.sms.survey-url}") String surveyUrl) {
        this.messagingProvider = messagingProvider;
        this.surveyUrl = surveyUrl;
    }

    /**
     * E.164 formatting: keep digits only, add the US country code to bare 10-digit numbers, prefix "+".
     * Any other length is passed through as is.
     */
    public String formatPhoneNumber(String phone) {
        String digits = phone == null ? "" : phone.replaceAll("\\D", "");
        if (digits.length() == 10) {
            digits = "1" + digits;
        }
        return "+" + digits;
    }

    public String composeMessage(String name) {
        String greeting = name != null && !name.isEmpty() ? "Hello " + name + "!" : "Hello!";

        return greeting + "\n\n"
                + "You're invited to participate in the District 5 Voter Survey for "
                + "Hyde Park, Mattapan, and Readville.\n\n"
                + "Your voice matters! Share your thoughts on important community issues.\n\n"
                + "Complete the survey here: " + surveyUrl + "\n\n"
                + "Thank you for your participation!";
    }

    /**
     * Sends one invitation. Provider failures come back as an unsuccessful record.
     */
    public SentMessageRecord sendOne(String phone, String name) {
        String formattedNumber = formatPhoneNumber(phone);
        String body = composeMessage(name);

        try {
            MessageResponse response = messagingProvider.sendMessage(formattedNumber, body);
            log.info("✓ SMS sent to {} (SID: {})", formattedNumber, response.getSid());
            return SentMessageRecord.builder()
                    .success(true)
                    .to(formattedNumber)
                    .sid(response.getSid())
                    .status(response.getStatus())
                    .timestamp(LocalDateTime.now().toString())
                    .name(name)
                    .build();
        } catch (MessagingProviderException e) {
            log.warn("✗ Failed to send SMS to {}: {}", phone, e.getMessage());
            return SentMessageRecord.builder()
                    .success(false)
                    .to(phone)
                    .error(e.getMessage())
                    .timestamp(LocalDateTime.now().toString())
                    .name(name)
                    .build();
        }
    }

    /**
     * Sends to every recipient in order, one at a time. Individual failures do not stop the run;
     * a recipient without a phone number is counted as failed and never reaches the provider.
     */
    public BulkSendSummary sendBulk(List<Recipient> recipients, SendLog sendLog) {
        log.info("Sending survey invitations to {} recipients...", recipients.size());
        BulkSendSummary summary = new BulkSendSummary(recipients.size());

        for (Recipient recipient : recipients) {
            if (recipient == null || recipient.getPhone() == null || recipient.getPhone().isEmpty()) {
                log.warn("✗ Skipping recipient: missing phone number");
                summary.recordSkipped();
                continue;
            }

            SentMessageRecord record = sendOne(recipient.getPhone(), recipient.getName());
            sendLog.add(record);
            summary.record(record);
        }

        log.info(SEPARATOR);
        log.info("Bulk SMS Send Summary:");
        log.info("Total: {}", summary.getTotal());
        log.info("Successful: {}", summary.getSuccessful());
        log.info("Failed: {}", summary.getFailed());
        log.info(SEPARATOR);
        return summary;
    }
}
