package com.finplan.plananalysis.service;

import com.finplan.plananalysis.entity.TagCorrection;
import com.finplan.plananalysis.exception.CorrectionHydrationException;
import com.finplan.plananalysis.exception.CorrectionNotFoundException;
import com.finplan.plananalysis.exception.CorrectionPersistenceException;
import com.finplan.plananalysis.exception.InvalidCorrectionException;
import com.finplan.plananalysis.metrics.PlanAnalysisMetrics;
import com.finplan.plananalysis.ml.LearnedCorrection;
import com.finplan.plananalysis.ml.TagPredictor;
import com.finplan.plananalysis.ml.TermNormalizer;
import com.finplan.plananalysis.ml.UserTagOverlay;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.model.ModelType;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermCorrectionCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Feedback loop between user corrections and the tag predictor.
 *
 * <p>A correction is persisted first and only then applied to the user's live overlay,
 * so a failed write never leaves the predictor ahead of the store. Overlays are
 * hydrated from the store on first use and replayed oldest first.
 *
 * <p>Every path that writes the store or publishes an overlay for a user runs under
 * that user's registry lock; a hydration therefore either sees a save's row or
 * publishes before the save teaches the overlay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectionLearningService {

    static final int MAX_STATS_LIMIT = 100;

    private final TagCorrectionStore store;
    private final UserOverlayRegistry overlays;
    private final TagPredictor predictor;
    private final PlanAnalysisMetrics metrics;

    /**
     * Persists the correction of {@code term} and applies it to the user's overlay.
     *
     * @throws InvalidCorrectionException     for a blank term or a missing/unknown corrected tag
     * @throws CorrectionPersistenceException when the store rejects the write; the overlay is untouched
     */
    public TagCorrection saveCorrection(UUID userId, String term, ItemTag predictedTag,
                                        ItemTag correctedTag, String sourceFileId) {
        String normalized = TermNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            throw InvalidCorrectionException.blankTerm();
        }
        if (correctedTag == null || correctedTag == ItemTag.UNKNOWN) {
            throw InvalidCorrectionException.unknownTag(correctedTag == null ? null : correctedTag.getCode());
        }

        TagCorrection saved = overlays.withUserLock(userId,
            () -> persistAndLearn(userId, normalized, predictedTag, correctedTag, sourceFileId));

        metrics.recordCorrectionSaved(correctedTag);
        log.info("User {} corrected '{}': {} -> {}", userId, normalized,
            predictedTag != null ? predictedTag : "-", correctedTag);
        return saved;
    }

    private TagCorrection persistAndLearn(UUID userId, String normalized, ItemTag predictedTag,
                                          ItemTag correctedTag, String sourceFileId) {
        TagCorrection saved;
        try {
            saved = store.upsert(TagCorrection.builder()
                .userId(userId)
                .term(normalized)
                .predictedTag(predictedTag != null ? predictedTag.getCode() : null)
                .correctedTag(correctedTag.getCode())
                .modelType(ModelType.TEXT)
                .sourceFileId(sourceFileId)
                .build());
        } catch (DataAccessException e) {
            metrics.recordCorrectionFailure();
            log.error("Failed to persist correction '{}' -> {} for user {}", normalized, correctedTag, userId, e);
            throw new CorrectionPersistenceException("Failed to save correction for '" + normalized + "'", e);
        }

        Optional<UserTagOverlay> live = overlays.find(userId);
        if (live.isPresent()) {
            live.get().learn(normalized, correctedTag);
        } else {
            // the store already holds the new row, so a fresh load includes it
            tryHydrate(userId);
        }
        return saved;
    }

    /**
     * Records a correction using the tag currently predicted for the user as the
     * predicted tag.
     */
    public TagCorrection learnFromCorrection(UUID userId, String term, ItemTag correctedTag, String sourceFileId) {
        UserTagOverlay overlay = overlays.find(userId).orElse(null);
        ItemTag predicted = predictor.predict(term, overlay).tag();
        return saveCorrection(userId, term, predicted, correctedTag, sourceFileId);
    }

    /**
     * The user's overlay, loading it from the store if it is not in memory.
     *
     * @throws CorrectionHydrationException when the store cannot be read
     */
    public UserTagOverlay overlayFor(UUID userId) {
        Optional<UserTagOverlay> live = overlays.find(userId);
        if (live.isPresent()) {
            return live.get();
        }
        return overlays.withUserLock(userId, () -> overlays.find(userId).orElseGet(() -> {
            UserTagOverlay loaded = loadOverlay(userId);
            overlays.put(loaded);
            return loaded;
        }));
    }

    /**
     * Replaces the user's in-memory overlay with a fresh load from the store.
     *
     * @throws CorrectionHydrationException when the store cannot be read; the previous
     *                                      overlay, if any, stays in place
     */
    public UserTagOverlay hydrateForUser(UUID userId) {
        return overlays.withUserLock(userId, () -> {
            UserTagOverlay overlay = loadOverlay(userId);
            overlays.put(overlay);
            return overlay;
        });
    }

    public void deleteCorrection(UUID userId, String term) {
        String normalized = TermNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            throw InvalidCorrectionException.blankTerm();
        }

        overlays.withUserLock(userId, () -> {
            boolean deleted;
            try {
                deleted = store.delete(userId, normalized, ModelType.TEXT);
            } catch (DataAccessException e) {
                log.error("Failed to delete correction '{}' for user {}", normalized, userId, e);
                throw new CorrectionPersistenceException("Failed to delete correction for '" + normalized + "'", e);
            }
            if (!deleted) {
                throw new CorrectionNotFoundException(normalized);
            }

            overlays.evict(userId);
            tryHydrate(userId);
            return deleted;
        });
        log.info("User {} removed correction for '{}'", userId, normalized);
    }

    public List<TagCorrection> listCorrections(UUID userId) {
        try {
            return store.findAllByUser(userId);
        } catch (DataAccessException e) {
            throw new CorrectionHydrationException(userId, e);
        }
    }

    /**
     * Terms corrected most often across all users.
     */
    public List<TermCorrectionCount> mostCorrectedTerms(int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_STATS_LIMIT));
        try {
            return store.mostCorrectedTerms(ModelType.TEXT, bounded);
        } catch (DataAccessException e) {
            log.error("Failed to load correction statistics", e);
            throw new CorrectionPersistenceException("Correction statistics are unavailable", e);
        }
    }

    private void tryHydrate(UUID userId) {
        try {
            hydrateForUser(userId);
        } catch (CorrectionHydrationException e) {
            log.warn("Overlay for user {} not refreshed, it will be loaded on next analysis: {}",
                userId, e.getMessage());
        }
    }

    private UserTagOverlay loadOverlay(UUID userId) {
        List<TagCorrection> rows;
        try {
            rows = store.findByUser(userId, ModelType.TEXT);
        } catch (DataAccessException e) {
            metrics.recordHydrationFailure();
            throw new CorrectionHydrationException(userId, e);
        }

        List<LearnedCorrection> batch = new ArrayList<>(rows.size());
        int skipped = 0;
        for (TagCorrection row : rows) {
            String term = TermNormalizer.normalize(row.getTerm());
            Optional<ItemTag> tag = ItemTag.fromCode(row.getCorrectedTag()).filter(t -> t != ItemTag.UNKNOWN);
            if (term.isEmpty() || tag.isEmpty()) {
                skipped++;
                log.warn("Skipping corrupt correction {} for user {}: term='{}', tag='{}'",
                    row.getId(), userId, row.getTerm(), row.getCorrectedTag());
                continue;
            }
            batch.add(new LearnedCorrection(term, tag.get()));
        }

        UserTagOverlay overlay = new UserTagOverlay(userId);
        overlay.learnBatch(batch);
        metrics.recordHydration(batch.size(), skipped);
        log.info("Hydrated overlay for user {} with {} corrections ({} skipped)", userId, batch.size(), skipped);
        return overlay;
    }
}
