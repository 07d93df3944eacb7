package ru.derendyaev.VoterSurvey.sms.twilio;

import ru.derendyaev.VoterSurvey.sms.twilio.dto.MessageResponse;

public interface MessagingProvider {

    /**
     * @param to   E.164 recipient number
     * @param body message text
     * @throws MessagingProviderException when the provider rejects the message or cannot be reached
     */
    MessageResponse sendMessage(String to, String body);
}
