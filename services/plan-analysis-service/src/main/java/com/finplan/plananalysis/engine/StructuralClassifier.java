package com.finplan.plananalysis.engine;

import org.springframework.stereotype.Component;

/**
 * Classifies a row as group, item or ignored by walking {@link StructuralRule} in order.
 * Pure and stateless.
 */
@Component
public class StructuralClassifier {

    public StructuralClassification classify(RowFeatures features, String categoryText) {
        String category = categoryText == null ? "" : categoryText.trim();
        for (StructuralRule rule : StructuralRule.values()) {
            if (rule.matches(features, category)) {
                return StructuralClassification.of(rule);
            }
        }
        // FALLBACK_IGNORE always matches
        throw new IllegalStateException("No structural rule matched");
    }
}
