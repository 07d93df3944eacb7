package ru.derendyaev.VoterSurvey.survey.exception;

public class BackupWriteException extends RuntimeException {

    public BackupWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
