package com.finplan.plananalysis.engine;

import com.finplan.plananalysis.model.NodeType;

public record StructuralClassification(NodeType nodeType, double confidence, StructuralRule rule) {

    static StructuralClassification of(StructuralRule rule) {
        return new StructuralClassification(rule.getNodeType(), rule.getConfidence(), rule);
    }
}
