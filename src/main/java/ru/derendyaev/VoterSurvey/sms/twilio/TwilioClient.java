package ru.derendyaev.VoterSurvey.sms.twilio;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import ru.derendyaev.VoterSurvey.sms.exception.SmsConfigurationException;
import ru.derendyaev.VoterSurvey.sms.twilio.dto.MessageResponse;
import ru.derendyaev.VoterSurvey.sms.twilio.dto.TwilioError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;

/**
 * Twilio Programmable Messaging over REST. Every failure leaves as {@link MessagingProviderException}.
 */
@Slf4j
@Service
public class TwilioClient implements MessagingProvider {

    static final String MESSAGES_URI = "/2010-04-01/Accounts/{accountSid}/Messages.json";

    private final WebClient webClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final String accountSid;
    private final String authToken;
    private final String fromNumber;

    public TwilioClient(@Qualifier("twilioWebClient") WebClient webClient,
                        @Value("${app.values.api.twilio.account-sid:}") String accountSid,
                        @Value("${app.values.api.twilio.auth-token:}") String authToken,
                        @Value("${app.values.api.twilio.from-number:}") String fromNumber) {
        if (isBlank(accountSid) || isBlank(authToken) || isBlank(fromNumber)) {
            throw new SmsConfigurationException(
                    "Missing required environment variables: TWILIO_ACCOUNT_SID, TWILIO_AUTH_TOKEN, TWILIO_PHONE_NUMBER");
        }
        this.webClient = webClient;
        this.accountSid = accountSid;
        this.authToken = authToken;
        this.fromNumber = fromNumber;
    }

    private HttpHeaders buildAuthHeaders() {
        String auth = accountSid + ":" + authToken;
        String encodedAuth = Base64.getEncoder().encodeToString(auth.getBytes(StandardCharsets.UTF_8));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encodedAuth);
        return headers;
    }

    @Override
    public MessageResponse sendMessage(String to, String body) {
        MessageResponse response;
        try {
            response = webClient.post()
                    .uri(MESSAGES_URI, accountSid)
                    .headers(httpHeaders -> httpHeaders.addAll(buildAuthHeaders()))
                    .body(BodyInserters.fromFormData("To", to)
                            .with("From", fromNumber)
                            .with("Body", body))
                    .retrieve()
                    .bodyToMono(MessageResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Twilio rejected message to {}: {} - {}", to, e.getStatusCode(), e.getResponseBodyAsString());
            TwilioError error = parseError(e.getResponseBodyAsString());
            String message = error != null && error.getMessage() != null
                    ? error.getMessage()
                    : e.getStatusCode() + " " + e.getStatusText();
            throw new MessagingProviderException(message, error != null ? error.getCode() : null, e);
        } catch (RuntimeException e) {
            log.error("Twilio request for {} failed: {}", to, e.getMessage());
            throw new MessagingProviderException("Twilio request failed: " + e.getMessage(), null, e);
        }

        if (response == null || response.getSid() == null) {
            throw new MessagingProviderException("Twilio returned no message sid", null, null);
        }
        return response;
    }

    private TwilioError parseError(String body) {
        if (isBlank(body)) {
            return null;
        }
        try {
            return objectMapper.readValue(body, TwilioError.class);
        } catch (IOException e) {
            log.debug("Twilio error body is not JSON: {}", body);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
