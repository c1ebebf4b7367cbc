package com.finplan.plananalysis.engine;

import com.finplan.plananalysis.model.NodeType;

import java.util.function.BiPredicate;

/**
 * Ordered structural rule table. Declaration order is evaluation order and the first
 * matching rule decides the row; {@link #FALLBACK_IGNORE} always matches.
 */
public enum StructuralRule {

    EMPTY_VALUE_HEADER(NodeType.GROUP, 0.95, (f, category) -> !category.isEmpty() && !f.hasValue()),
    UPPERCASE_HEADER(NodeType.GROUP, 0.85, (f, category) -> f.isUppercase() && category.length() > 3),
    STYLED_HEADER(NodeType.GROUP, 0.80, (f, category) -> f.isBold() && !f.hasValue()),
    INDENTED_ITEM(NodeType.ITEM, 0.90, (f, category) -> f.indentation() > 0),
    FORMULA_VALUE_ITEM(NodeType.ITEM, 0.85, (f, category) -> f.hasValue() && f.hasFormula()),
    VALUE_ITEM(NodeType.ITEM, 0.70, (f, category) -> f.hasValue()),
    FALLBACK_IGNORE(NodeType.IGNORE, 0.50, (f, category) -> true);

    private final NodeType nodeType;
    private final double confidence;
    private final BiPredicate<RowFeatures, String> predicate;

    StructuralRule(NodeType nodeType, double confidence, BiPredicate<RowFeatures, String> predicate) {
        this.nodeType = nodeType;
        this.confidence = confidence;
        this.predicate = predicate;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    public double getConfidence() {
        return confidence;
    }

    boolean matches(RowFeatures features, String category) {
        return predicate.test(features, category);
    }
}
