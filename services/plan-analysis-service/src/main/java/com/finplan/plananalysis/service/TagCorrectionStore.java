package com.finplan.plananalysis.service;

import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.model.ModelType;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermConsensus;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermCorrectionCount;

import java.util.List;
import java.util.UUID;

/**
 * Durable storage of user tag corrections.
 *
 * <p>Failures surface as Spring {@link org.springframework.dao.DataAccessException}s;
 * callers decide how to degrade.
 */
public interface TagCorrectionStore {

    /**
     * The user's corrections for one model, oldest first.
     */
    List<TagCorrection> findByUser(UUID userId, ModelType modelType);

    /**
     * All of the user's corrections, most recently updated first.
     */
    List<TagCorrection> findAllByUser(UUID userId);

    /**
     * Inserts or overwrites the correction keyed by (user, term, model type).
     */
    TagCorrection upsert(TagCorrection correction);

    /**
     * @return whether a correction was removed
     */
    boolean delete(UUID userId, String term, ModelType modelType);

    List<TermCorrectionCount> mostCorrectedTerms(ModelType modelType, int limit);

    /**
     * (term, tag) pairs that at least {@code minDistinctUsers} users agree on, by term and
     * then by agreeing users, most first.
     */
    List<TermConsensus> consensusTerms(ModelType modelType, int minDistinctUsers);
}
