package com.finplan.plananalysis.service;

import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.model.ModelType;
import com.finplan.plananalysis.repository.TagCorrectionRepository;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermConsensus;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermCorrectionCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTagCorrectionStore implements TagCorrectionStore {

    /**
     * Single-statement upsert; concurrent saves of one key resolve to the last writer
     * instead of failing on the unique constraint.
     */
    private static final String UPSERT_SQL = """
        INSERT INTO user_tag_corrections
            (user_id, term, predicted_tag, corrected_tag, model_type, source_file_id)
        VALUES (?, ?, ?, ?, ?, ?)
        ON CONFLICT (user_id, term, model_type) DO UPDATE SET
            predicted_tag = EXCLUDED.predicted_tag,
            corrected_tag = EXCLUDED.corrected_tag,
            source_file_id = EXCLUDED.source_file_id,
            updated_at = CURRENT_TIMESTAMP
        RETURNING id, user_id, term, predicted_tag, corrected_tag, model_type,
                  source_file_id, created_at, updated_at
        """;

    private static final RowMapper<TagCorrection> ROW_MAPPER = (rs, rowNum) -> TagCorrection.builder()
        .id(rs.getObject("id", UUID.class))
        .userId(rs.getObject("user_id", UUID.class))
        .term(rs.getString("term"))
        .predictedTag(rs.getString("predicted_tag"))
        .correctedTag(rs.getString("corrected_tag"))
        .modelType(ModelType.valueOf(rs.getString("model_type")))
        .sourceFileId(rs.getString("source_file_id"))
        .createdAt(toLocalDateTime(rs.getTimestamp("created_at")))
        .updatedAt(toLocalDateTime(rs.getTimestamp("updated_at")))
        .build();

    private final TagCorrectionRepository repository;
    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional(readOnly = true)
    public List<TagCorrection> findByUser(UUID userId, ModelType modelType) {
        return repository.findByUserIdAndModelTypeOrderByUpdatedAtAscIdAsc(userId, modelType);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TagCorrection> findAllByUser(UUID userId) {
        return repository.findByUserIdOrderByUpdatedAtDesc(userId);
    }

    @Override
    @Transactional
    public TagCorrection upsert(TagCorrection correction) {
        TagCorrection saved = jdbcTemplate.queryForObject(UPSERT_SQL, ROW_MAPPER,
            correction.getUserId(),
            correction.getTerm(),
            correction.getPredictedTag(),
            correction.getCorrectedTag(),
            correction.getModelType().name(),
            correction.getSourceFileId());
        log.debug("Stored {} correction '{}' -> {} for user {}",
            saved.getModelType(), saved.getTerm(), saved.getCorrectedTag(), saved.getUserId());
        return saved;
    }

    @Override
    @Transactional
    public boolean delete(UUID userId, String term, ModelType modelType) {
        return repository.deleteByUserIdAndTermAndModelType(userId, term, modelType) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TermCorrectionCount> mostCorrectedTerms(ModelType modelType, int limit) {
        return repository.findMostCorrectedTerms(modelType, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TermConsensus> consensusTerms(ModelType modelType, int minDistinctUsers) {
        return repository.findConsensusTerms(modelType, minDistinctUsers);
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
