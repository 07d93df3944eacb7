package ru.derendyaev.VoterSurvey.survey.exception;

/**
 * Raised when the response store cannot be read or written.
 */
public class SurveyStorageException extends RuntimeException {

    public SurveyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
