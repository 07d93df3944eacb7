package ru.derendyaev.VoterSurvey.sms.twilio;

import lombok.Getter;

/**
 * A message could not be handed to the provider. {@code code} is the provider's error code when it sent one.
 */
@Getter
public class MessagingProviderException extends RuntimeException {

    private final Integer code;

    public MessagingProviderException(String message, Integer code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
