package ru.derendyaev.VoterSurvey.survey.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Configuration
public class DataDirectoryConfig {

    private static final String DATABASE_NAME = "survey_responses";

    /**
     * Directory holding the database, the backup document and CSV exports. Created on first start.
     */
    @Bean("surveyDataDir")
    public Path surveyDataDir(@Value("${app.values.survey.data-dir}") String dataDir) {
        Path path = Path.of(dataDir).toAbsolutePath();
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory " + path, e);
        }
        log.info("Survey data directory: {}", path);
        return path;
    }

    /**
     * File-mode H2 database inside the data directory unless {@code spring.datasource.url} is set.
     * H2 refuses implicitly relative file paths, so the URL is built from the absolute directory.
     */
    @Bean
    public DataSource dataSource(DataSourceProperties properties, @Qualifier("surveyDataDir") Path dataDir) {
        if (properties.getUrl() == null) {
            properties.setUrl("jdbc:h2:file:" + dataDir.resolve(DATABASE_NAME));
        }
        log.info("Survey database: {}", properties.getUrl());
        return properties.initializeDataSourceBuilder().build();
    }
}
