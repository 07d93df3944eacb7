package ru.derendyaev.VoterSurvey.survey.backup;

import java.util.Map;

/**
 * Secondary copy of every accepted submission, written after the store insert succeeds.
 * The two writes are not atomic.
 */
public interface ResponseBackup {

    void append(Map<String, Object> payload);
}
