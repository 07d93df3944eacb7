package ru.derendyaev.VoterSurvey.sms.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Send attempts of a single run. Created by the caller and handed to whatever sends; lives only as long as the run.
 */
public class SendLog {

    private final List<SentMessageRecord> messages = new ArrayList<>();

    public void add(SentMessageRecord record) {
        messages.add(record);
    }

    public List<SentMessageRecord> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }
}
