package com.finplan.plananalysis.ml;

import com.finplan.plananalysis.model.ItemTag;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Predicts the semantic tag of a budget line from its category text.
 *
 * <p>Lookup order, first hit wins:
 * <ol>
 *   <li>the requesting user's overlay, exact normalized term, confidence {@value #USER_CONFIDENCE}</li>
 *   <li>the process-wide global overlay, exact normalized term, confidence {@value #GLOBAL_CONFIDENCE}</li>
 *   <li>the built-in {@link BaselineTagVocabulary}</li>
 * </ol>
 * Terms unknown to every layer predict {@link ItemTag#UNKNOWN} with confidence
 * {@value TagPrediction#UNKNOWN_CONFIDENCE}. Personalization never mutates the
 * shared layers.
 */
@Slf4j
public class TagPredictor {

    public static final double USER_CONFIDENCE = 0.98;
    public static final double GLOBAL_CONFIDENCE = 0.95;

    private final BaselineTagVocabulary baseline;
    private final TagMemory global;

    public TagPredictor(BaselineTagVocabulary baseline) {
        this(baseline, new TagMemory());
    }

    public TagPredictor(BaselineTagVocabulary baseline, TagMemory global) {
        this.baseline = baseline;
        this.global = global;
    }

    public TagPrediction predict(String term) {
        return predict(term, null);
    }

    /**
     * @param overlay the requesting user's overlay, or null to use the shared layers only
     */
    public TagPrediction predict(String term, UserTagOverlay overlay) {
        String normalized = TermNormalizer.normalize(term);
        if (normalized.isEmpty()) {
            return TagPrediction.unknown();
        }

        if (overlay != null) {
            Optional<ItemTag> learned = overlay.lookup(normalized);
            if (learned.isPresent()) {
                return new TagPrediction(learned.get(), USER_CONFIDENCE, PredictionSource.USER);
            }
        }

        Optional<ItemTag> shared = global.lookup(normalized);
        if (shared.isPresent()) {
            return new TagPrediction(shared.get(), GLOBAL_CONFIDENCE, PredictionSource.GLOBAL);
        }

        return baseline.score(normalized);
    }

    public void learnGlobal(String term, ItemTag tag) {
        global.learn(term, tag);
    }

    /**
     * Applies the corrections to the global overlay as one atomic update.
     */
    public void learnGlobalBatch(List<LearnedCorrection> corrections) {
        global.learnBatch(corrections);
        log.info("Global tag overlay updated with {} terms, {} known", corrections.size(), global.size());
    }

    public int globalSize() {
        return global.size();
    }
}
