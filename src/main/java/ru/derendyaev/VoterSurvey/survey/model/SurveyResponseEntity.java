package ru.derendyaev.VoterSurvey.survey.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.*;

import java.util.List;

/**
 * One voter's submission. Rows are append-only: there is no update or delete path.
 * Serialised with the storage column names so the list endpoint and the CSV export agree.
 */
@Entity
@Table(name = "responses")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SurveyResponseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "phone_number", nullable = false)
    private String phoneNumber;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    private String email = "";

    @Column(nullable = false)
    private String neighborhood;

    @Column(name = "age_group", nullable = false)
    private String ageGroup;

    @Column(name = "voting_frequency", nullable = false)
    private String votingFrequency;

    @Convert(converter = IssuesConverter.class)
    @Column(nullable = false)
    private List<String> issues;

    @Column(nullable = false)
    private String engagement;

    @Column(name = "additional_comments")
    @Builder.Default
    private String additionalComments = "";

    @Column(nullable = false)
    private String timestamp;
}
