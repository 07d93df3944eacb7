package ru.derendyaev.VoterSurvey.survey.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import ru.derendyaev.VoterSurvey.survey.exception.SurveyStorageException;
import ru.derendyaev.VoterSurvey.survey.model.GroupingField;
import ru.derendyaev.VoterSurvey.survey.model.SurveyResponseEntity;
import ru.derendyaev.VoterSurvey.survey.model.SurveyStats;
import ru.derendyaev.VoterSurvey.survey.repository.GroupCount;
import ru.derendyaev.VoterSurvey.survey.repository.SurveyResponseRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Storage access for survey responses. Every {@link DataAccessException} leaves this class as a
 * {@link SurveyStorageException}; nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyResponseService {

    private final SurveyResponseRepository repository;

    /**
     * Appends one response and returns the identifier the store assigned to it.
     */
    public Long insert(SurveyResponseEntity response) {
        SurveyResponseEntity saved = guarded("insert survey response",
                () -> repository.save(response));
        log.debug("Inserted survey response id={}", saved.getId());
        return saved.getId();
    }

    /**
     * All responses, newest timestamp first.
     */
    public List<SurveyResponseEntity> listAll() {
        return guarded("list survey responses", repository::findAllByOrderByTimestampDesc);
    }

    public long countAll() {
        return guarded("count survey responses", repository::count);
    }

    public Map<String, Long> countGroupedBy(GroupingField field) {
        List<GroupCount> buckets = guarded("count responses by " + field, () -> switch (field) {
            case NEIGHBORHOOD -> repository.countByNeighborhood();
            case AGE_GROUP -> repository.countByAgeGroup();
            case VOTING_FREQUENCY -> repository.countByVotingFrequency();
        });

        Map<String, Long> counts = new LinkedHashMap<>();
        for (GroupCount bucket : buckets) {
            counts.put(bucket.getGroupValue(), bucket.getGroupCount());
        }
        return counts;
    }

    public SurveyStats stats() {
        return SurveyStats.builder()
                .total(countAll())
                .byNeighborhood(countGroupedBy(GroupingField.NEIGHBORHOOD))
                .byAgeGroup(countGroupedBy(GroupingField.AGE_GROUP))
                .byVotingFrequency(countGroupedBy(GroupingField.VOTING_FREQUENCY))
                .build();
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Storage failure during {}: {}", operation, e.getMessage());
            throw new SurveyStorageException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
