package com.finplan.plananalysis.service;

import com.finplan.plananalysis.config.PlanAnalysisProperties;
import com.finplan.plananalysis.metrics.PlanAnalysisMetrics;
import com.finplan.plananalysis.ml.BaselineTagVocabulary;
import com.finplan.plananalysis.ml.PredictionSource;
import com.finplan.plananalysis.ml.TagPrediction;
import com.finplan.plananalysis.ml.TagPredictor;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.model.ModelType;
import com.finplan.plananalysis.repository.TagCorrectionRepository.TermConsensus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalCorrectionPromoter Tests")
class GlobalCorrectionPromoterTest {

    @Mock
    private TagCorrectionStore store;

    @Mock
    private PlanAnalysisMetrics metrics;

    private TagPredictor predictor;
    private GlobalCorrectionPromoter promoter;

    @BeforeEach
    void setUp() {
        predictor = new TagPredictor(BaselineTagVocabulary.defaults());
        promoter = new GlobalCorrectionPromoter(store, predictor, new PlanAnalysisProperties(), metrics);
    }

    private record Consensus(String term, String correctedTag, long users) implements TermConsensus {

        @Override
        public String getTerm() {
            return term;
        }

        @Override
        public String getCorrectedTag() {
            return correctedTag;
        }

        @Override
        public Long getUsers() {
            return users;
        }
    }

    @Test
    @DisplayName("Should promote the tag most users agree on")
    void shouldPromoteConsensus() {
        // Given
        when(store.consensusTerms(ModelType.TEXT, 3)).thenReturn(List.of(
            new Consensus("lidl", "B", 5),
            new Consensus("lidl", "D", 3),
            new Consensus("gym", "S", 3)));

        // When
        int promoted = promoter.promoteConsensusTerms();

        // Then
        assertThat(promoted).isEqualTo(2);
        assertThat(predictor.predict("Lidl"))
            .isEqualTo(new TagPrediction(ItemTag.BUDGET, TagPredictor.GLOBAL_CONFIDENCE, PredictionSource.GLOBAL));
        assertThat(predictor.predict("gym").tag()).isEqualTo(ItemTag.SAVINGS);
        verify(metrics).recordPromotion(2);
    }

    @Test
    @DisplayName("Should not promote terms whose top tags are tied")
    void shouldSkipAmbiguousTerms() {
        // Given
        when(store.consensusTerms(ModelType.TEXT, 3)).thenReturn(List.of(
            new Consensus("aldi", "B", 4),
            new Consensus("aldi", "D", 4),
            new Consensus("spotify", "R", 3)));

        // When
        int promoted = promoter.promoteConsensusTerms();

        // Then
        assertThat(promoted).isEqualTo(1);
        assertThat(predictor.predict("aldi").source()).isNotEqualTo(PredictionSource.GLOBAL);
        assertThat(predictor.globalSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should skip corrupt consensus rows")
    void shouldSkipCorruptRows() {
        // Given
        when(store.consensusTerms(ModelType.TEXT, 3)).thenReturn(List.of(
            new Consensus("  ", "B", 3),
            new Consensus("kiosk", "XX", 6),
            new Consensus("bakery", "", 3),
            new Consensus("pension", "S", 3)));

        // When
        int promoted = promoter.promoteConsensusTerms();

        // Then
        assertThat(promoted).isEqualTo(1);
        assertThat(predictor.globalSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should leave the global layer untouched when nothing qualifies")
    void shouldDoNothingWithoutConsensus() {
        when(store.consensusTerms(ModelType.TEXT, 3)).thenReturn(List.of());

        assertThat(promoter.promoteConsensusTerms()).isZero();
        assertThat(predictor.globalSize()).isZero();
        verify(metrics, never()).recordPromotion(anyInt());
    }

    @Test
    @DisplayName("Should survive a store outage during a scheduled run")
    void shouldSurviveStoreOutage() {
        when(store.consensusTerms(ModelType.TEXT, 3))
            .thenThrow(new DataAccessResourceFailureException("database down"));

        assertThatCode(() -> promoter.scheduledPromotion()).doesNotThrowAnyException();
        assertThat(predictor.globalSize()).isZero();
    }
}
