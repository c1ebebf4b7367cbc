package com.finplan.plananalysis.config;

import com.finplan.plananalysis.ml.BaselineTagVocabulary;
import com.finplan.plananalysis.ml.TagPredictor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the shared tag predictor. Per-user overlays are managed by
 * {@link com.finplan.plananalysis.service.UserOverlayRegistry}.
 */
@Configuration
@Slf4j
public class PredictorConfig {

    @Bean
    public BaselineTagVocabulary baselineTagVocabulary() {
        return BaselineTagVocabulary.defaults();
    }

    @Bean
    public TagPredictor tagPredictor(BaselineTagVocabulary baselineTagVocabulary) {
        log.info("Creating tag predictor with built-in baseline vocabulary");
        return new TagPredictor(baselineTagVocabulary);
    }
}
