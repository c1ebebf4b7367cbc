package com.finplan.plananalysis.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Plan analysis configuration (finplan.plan-analysis.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "finplan.plan-analysis")
public class PlanAnalysisProperties {

    /**
     * Rows sampled for column profiles when the caller does not say; 0 means all rows
     */
    @Min(0)
    private int profileSampleRows = 100;

    /**
     * Category column used when detection finds no text column
     */
    @Pattern(regexp = "[A-Za-z]{1,3}")
    private String defaultCategoryColumn = "A";

    /**
     * Value column used when detection finds no numeric column
     */
    @Pattern(regexp = "[A-Za-z]{1,3}")
    private String defaultValueColumn = "C";

    @Valid
    private OverlayCache overlayCache = new OverlayCache();

    @Valid
    private Promotion promotion = new Promotion();

    @Data
    public static class OverlayCache {
        /**
         * Users whose learned overlays are kept in memory
         */
        @Min(1)
        private long maxUsers = 10_000;

        /**
         * Idle time after which a user's overlay is evicted and re-hydrated on next use
         */
        @NotNull
        private Duration expireAfterAccess = Duration.ofMinutes(30);
    }

    @Data
    public static class Promotion {
        private boolean enabled = true;

        /**
         * Distinct users that must agree on a term's tag before it goes global
         */
        @Min(2)
        private int minDistinctUsers = 3;

        @Min(1000)
        private long intervalMs = 900_000;

        @Min(0)
        private long initialDelayMs = 60_000;
    }
}
