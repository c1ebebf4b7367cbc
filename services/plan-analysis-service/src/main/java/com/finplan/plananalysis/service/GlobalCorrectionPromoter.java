package com.finplan.plananalysis.service;

import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.metrics.PlanAnalysisMetrics;
import com.finplan.plananalysis.ml.LearnedCorrection;
import com.finplan.plananalysis.ml.TagPredictor;
import com.finplan.plananalysis.ml.TermNormalizer;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.model.ModelType;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermConsensus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Periodically promotes terms that enough distinct users corrected to the same tag
 * into the global overlay, so every user benefits from them.
 *
 * <p>A term whose top two tags have the same number of users is ambiguous and is not
 * promoted. Each run applies its terms as a single batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "finplan.plan-analysis.promotion", name = "enabled",
    havingValue = "true", matchIfMissing = true)
public class GlobalCorrectionPromoter {

    private final TagCorrectionStore store;
    private final TagPredictor predictor;
    private final PlanAnalysisProperties properties;
    private final PlanAnalysisMetrics metrics;

    @Scheduled(fixedDelayString = "${finplan.plan-analysis.promotion.interval-ms:900000}",
        initialDelayString = "${finplan.plan-analysis.promotion.initial-delay-ms:60000}")
    public void scheduledPromotion() {
        try {
            promoteConsensusTerms();
        } catch (DataAccessException e) {
            log.error("Global correction promotion skipped, store unavailable", e);
        }
    }

    /**
     * @return number of terms applied to the global overlay
     */
    public int promoteConsensusTerms() {
        int minUsers = properties.getPromotion().getMinDistinctUsers();
        List<TermConsensus> rows = store.consensusTerms(ModelType.TEXT, minUsers);

        Map<String, TermConsensus> winners = new LinkedHashMap<>();
        List<String> ambiguous = new ArrayList<>();
        for (TermConsensus row : rows) {
            String term = TermNormalizer.normalize(row.getTerm());
            TermConsensus current = winners.get(term);
            if (current == null) {
                winners.put(term, row);
            } else if (current.getUsers().equals(row.getUsers())) {
                ambiguous.add(term);
            }
        }
        ambiguous.forEach(winners::remove);

        List<LearnedCorrection> batch = new ArrayList<>();
        winners.forEach((term, row) -> {
            Optional<ItemTag> tag = ItemTag.fromCode(row.getCorrectedTag()).filter(t -> t != ItemTag.UNKNOWN);
            if (term.isEmpty() || tag.isEmpty()) {
                log.warn("Not promoting corrupt consensus row: term='{}', tag='{}'", row.getTerm(), row.getCorrectedTag());
                return;
            }
            batch.add(new LearnedCorrection(term, tag.get()));
        });

        if (!ambiguous.isEmpty()) {
            log.debug("Ambiguous terms not promoted: {}", ambiguous);
        }
        if (batch.isEmpty()) {
            return 0;
        }

        predictor.learnGlobalBatch(batch);
        metrics.recordPromotion(batch.size());
        log.info("Promoted {} terms agreed on by at least {} users", batch.size(), minUsers);
        return batch.size();
    }
}
