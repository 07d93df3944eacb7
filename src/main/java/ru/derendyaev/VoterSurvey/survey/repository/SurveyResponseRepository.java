package ru.derendyaev.VoterSurvey.survey.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;

import java.util.List;

@Repository
public interface SurveyResponseRepository extends JpaRepository<SurveyResponseEntity, Long> {

    List<SurveyResponseEntity> findAllByOrderByTimestampDesc();

    @Query("select r.neighborhood as groupValue, count(r) as groupCount from SurveyResponseEntity r group by r.neighborhood")
    List<GroupCount> countByNeighborhood();

    @Query("select r.ageGroup as groupValue, count(r) as groupCount from SurveyResponseEntity r group by r.ageGroup")
    List<GroupCount> countByAgeGroup();

    @Query("select r.votingFrequency as groupValue, count(r) as groupCount from SurveyResponseEntity r group by r.votingFrequency")
    List<GroupCount> countByVotingFrequency();
}
