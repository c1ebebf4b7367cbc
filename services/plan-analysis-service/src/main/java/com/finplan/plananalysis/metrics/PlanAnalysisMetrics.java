package com.finplan.plananalysis.metrics;

import com.finplan.plananalysis.model.AnalysisTreeResult;
import com.finplan.plananalysis.model.ItemTag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Micrometer metrics for sheet analysis and correction learning
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlanAnalysisMetrics {

    private final MeterRegistry meterRegistry;

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record a completed tree analysis and its review counts
     */
    public void recordAnalysis(Timer.Sample sample, AnalysisTreeResult result) {
        sample.stop(Timer.builder("plan.analysis.duration")
            .tag("personalized", String.valueOf(result.isPersonalized()))
            .register(meterRegistry));

        Counter.builder("plan.analysis.completed")
            .register(meterRegistry)
            .increment();
        Counter.builder("plan.analysis.items")
            .tag("review", "needed")
            .register(meterRegistry)
            .increment(result.getItemsNeedingReview());
        Counter.builder("plan.analysis.items")
            .tag("review", "auto_approved")
            .register(meterRegistry)
            .increment(result.getAutoApprovedItems());

        meterRegistry.summary("plan.analysis.confidence")
            .record(result.getOverallConfidence());
    }

    public void recordAnalysisFailure(String reason) {
        Counter.builder("plan.analysis.failed")
            .tag("reason", reason)
            .register(meterRegistry)
            .increment();
    }

    public void recordCorrectionSaved(ItemTag tag) {
        Counter.builder("plan.corrections.saved")
            .tag("tag", tag.name())
            .register(meterRegistry)
            .increment();
    }

    public void recordCorrectionFailure() {
        Counter.builder("plan.corrections.failed")
            .register(meterRegistry)
            .increment();
    }

    public void recordHydration(int corrections, int skipped) {
        meterRegistry.summary("plan.overlay.hydrated.corrections").record(corrections);
        if (skipped > 0) {
            Counter.builder("plan.overlay.hydration.skipped")
                .register(meterRegistry)
                .increment(skipped);
        }
    }

    public void recordHydrationFailure() {
        Counter.builder("plan.overlay.hydration.failed")
            .register(meterRegistry)
            .increment();
    }

    public void recordPromotion(int terms) {
        Counter.builder("plan.global.promoted.terms")
            .register(meterRegistry)
            .increment(terms);
    }
}
