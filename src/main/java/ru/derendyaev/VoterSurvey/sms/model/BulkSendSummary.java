package ru.derendyaev.VoterSurvey.sms.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
public class BulkSendSummary {

    private final int total;
    private int successful;
    private int failed;
    private final List<SentMessageRecord> details = new ArrayList<>();

    public BulkSendSummary(int total) {
        this.total = total;
    }

    /** Recipient skipped before any send attempt. */
    public void recordSkipped() {
        failed++;
    }

    public void record(SentMessageRecord record) {
        details.add(record);
        if (record.isSuccess()) {
            successful++;
        } else {
            failed++;
        }
    }

    public List<SentMessageRecord> getDetails() {
        return Collections.unmodifiableList(details);
    }
}
