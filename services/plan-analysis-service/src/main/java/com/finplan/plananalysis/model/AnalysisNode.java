package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One node of the analysis tree.
 *
 * <p>The tree is exactly two levels deep: only {@link NodeType#GROUP} nodes have
 * children and those children are always {@link NodeType#ITEM} nodes. Review flags are
 * derived from {@link #getConfidence()} against {@link Confidence#AUTO_APPROVAL_THRESHOLD}
 * and are never stored separately.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "children")
public class AnalysisNode {

    private final String id;
    private final String name;
    private final double value;
    private final NodeType type;
    private final ItemTag tag;
    private final double confidence;
    private final String excelCell;
    private final int excelRow;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final String formula;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @Builder.Default
    private final List<AnalysisNode> children = List.of();

    public boolean isNeedsReview() {
        return Confidence.needsReview(confidence);
    }

    @JsonProperty("isAutoApproved")
    public boolean isAutoApproved() {
        return Confidence.isAutoApproved(confidence);
    }

    /**
     * Value in minor currency units (cents), truncated.
     */
    public long getValueMinor() {
        return (long) (value * 100);
    }
}
