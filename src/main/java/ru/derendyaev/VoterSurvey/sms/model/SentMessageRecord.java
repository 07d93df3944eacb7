package ru.derendyaev.VoterSurvey.sms.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one send attempt. {@code sid}/{@code status} are set on success, {@code error} on failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SentMessageRecord {
    private boolean success;
    private String to;
    private String sid;
    private String status;
    private String error;
    private String timestamp;
    private String name;
}
