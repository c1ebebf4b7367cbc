package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Hierarchical analysis of one sheet plus its aggregate statistics.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisTreeResult {

    private final String sheetName;

    @Builder.Default
    private final List<AnalysisNode> nodes = List.of();

    private final int totalGroups;
    private final int totalItems;

    /** Mean confidence over every node, groups and items together. */
    private final double overallConfidence;

    private final int itemsNeedingReview;
    private final int autoApprovedItems;

    private final List<ColumnProfile> columnProfiles;
    private final ColumnMapping detectedMapping;

    /** Whether the requesting user's learned corrections were applied. */
    private final boolean personalized;
}
