package ru.derendyaev.VoterSurvey.sms;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import ru.derendyaev.VoterSurvey.sms.cli.InviteCommand;

/**
 * Command line tool that texts survey invitations. Shares nothing with the survey service at runtime.
 * <pre>
 *   SmsInviteApplication &lt;phone_number&gt; [name]
 *   SmsInviteApplication --bulk &lt;recipients_file.json&gt;
 * </pre>
 */
@Slf4j
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, HibernateJpaAutoConfiguration.class})
public class SmsInviteApplication {

    public static void main(String[] args) {
        try {
            InviteCommand.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("Error: " + e.getMessage());
            System.out.println(InviteCommand.USAGE);
            System.exit(1);
        }

        int exitCode;
        try {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(SmsInviteApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
            exitCode = SpringApplication.exit(context);
        } catch (Exception e) {
            log.error("Error: {}", e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
