package ru.derendyaev.VoterSurvey.sms.exception;

/**
 * Messaging credentials are missing; the tool cannot start.
 */
public class SmsConfigurationException extends RuntimeException {

    public SmsConfigurationException(String message) {
        super(message);
    }
}
