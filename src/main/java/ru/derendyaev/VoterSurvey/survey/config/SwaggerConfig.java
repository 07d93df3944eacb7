package ru.derendyaev.VoterSurvey.survey.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI voterSurveyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("District 5 Voter Survey API")
                        .description("""
                                Collects voter survey responses for Hyde Park, Mattapan and Readville.
                                Submission, listing, CSV export and response statistics.
                                """)
                        .version("1.0.0"));
    }
}
