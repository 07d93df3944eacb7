package ru.derendyaev.VoterSurvey.sms.twilio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwilioError {
    private Integer code;
    private String message;
    private Integer status;

    @JsonProperty("more_info")
    private String moreInfo;
}
