package ru.derendyaev.VoterSurvey.sms.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    @Value("${app.values.api.twilio.base-url}")
    private String twilioBaseUrl;

    @Bean("twilioWebClient")
    public WebClient twilioWebClient() {
        HttpClient httpClient = HttpClient.create();

        return WebClient.builder()
                .baseUrl(twilioBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
