package com.finplan.plananalysis.engine;

import com.finplan.plananalysis.ml.TagPrediction;
import com.finplan.plananalysis.ml.TagPredictor;
import com.finplan.plananalysis.ml.UserTagOverlay;
import com.finplan.plananalysis.model.AnalysisNode;
import com.finplan.plananalysis.model.AnalysisTreeResult;
import com.finplan.plananalysis.model.Confidence;
import com.finplan.plananalysis.model.ItemTag;
import com.finplan.plananalysis.model.NodeType;
import com.finplan.plananalysis.sheet.CellRefs;
import com.finplan.plananalysis.sheet.NumericValues;
import com.finplan.plananalysis.sheet.SheetSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a sheet top to bottom and assembles the two-level group/item tree.
 *
 * <p>Each row with a non-empty category is classified structurally and tagged; the
 * node confidence is the mean of both. Items seen before any group are collected
 * under a synthetic {@value #SYNTHETIC_GROUP_NAME} group that always needs review.
 * The walk runs on the calling thread and does no I/O.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TreeBuilder {

    public static final String SYNTHETIC_GROUP_NAME = "Imported Items";
    public static final double SYNTHETIC_GROUP_CONFIDENCE = 0.5;

    private final RowFeatureExtractor featureExtractor;
    private final StructuralClassifier classifier;
    private final TagPredictor tagPredictor;

    /**
     * @param overlay the requesting user's learned corrections, or null
     */
    public AnalysisTreeResult build(SheetSnapshot sheet, TreeLayout layout, UserTagOverlay overlay) {
        NodeIdGenerator ids = new NodeIdGenerator();
        List<AnalysisNode> nodes = new ArrayList<>();
        OpenGroup open = null;
        int totalRows = sheet.getRowCount();

        for (int row = layout.startRow(); row <= totalRows; row++) {
            String rawCategory = sheet.cellText(row, layout.categoryColumn());
            String category = rawCategory.trim();
            if (category.isEmpty()) {
                continue;
            }
            String valueText = sheet.cellText(row, layout.valueColumn()).trim();
            String formula = sheet.formulaAt(row, layout.valueColumn());

            RowFeatures features = featureExtractor.extract(rawCategory, valueText,
                sheet.styleAt(row, layout.categoryColumn()), !formula.isEmpty(), row, totalRows);
            StructuralClassification classification = classifier.classify(features, category);
            TagPrediction prediction = tagPredictor.predict(category, overlay);

            AnalysisNode node = AnalysisNode.builder()
                .id(ids.next())
                .name(category)
                .value(NumericValues.valueOrZero(valueText))
                .type(classification.nodeType())
                .tag(prediction.tag())
                .confidence(Confidence.mean(classification.confidence(), prediction.confidence()))
                .excelCell(CellRefs.cellName(layout.categoryColumn(), row))
                .excelRow(row)
                .formula(formula)
                .build();

            log.debug("Row {} '{}' -> {} via {} ({}), tag {} from {}", row, category,
                classification.nodeType(), classification.rule(), node.getConfidence(),
                prediction.tag(), prediction.source());

            switch (classification.nodeType()) {
                case GROUP -> {
                    if (open != null) {
                        nodes.add(open.freeze());
                    }
                    open = new OpenGroup(node);
                }
                case ITEM -> {
                    if (open == null) {
                        open = new OpenGroup(syntheticGroup(ids.next()));
                    }
                    open.children.add(node);
                }
                case IGNORE -> {
                    // dropped, group state untouched
                }
            }
        }
        if (open != null) {
            nodes.add(open.freeze());
        }

        AnalysisTreeResult result = summarize(sheet.getSheetName(), nodes);
        log.info("Built tree for sheet '{}': {} groups, {} items, confidence {}",
            sheet.getSheetName(), result.getTotalGroups(), result.getTotalItems(),
            String.format("%.3f", result.getOverallConfidence()));
        return result;
    }

    /**
     * Aggregates counts and the mean confidence over every group and item.
     */
    public static AnalysisTreeResult summarize(String sheetName, List<AnalysisNode> nodes) {
        int items = 0;
        int needingReview = 0;
        int autoApproved = 0;
        double confidenceSum = 0;

        for (AnalysisNode group : nodes) {
            confidenceSum += group.getConfidence();
            for (AnalysisNode item : group.getChildren()) {
                items++;
                confidenceSum += item.getConfidence();
                if (item.isNeedsReview()) {
                    needingReview++;
                } else {
                    autoApproved++;
                }
            }
        }

        int totalNodes = nodes.size() + items;
        return AnalysisTreeResult.builder()
            .sheetName(sheetName)
            .nodes(List.copyOf(nodes))
            .totalGroups(nodes.size())
            .totalItems(items)
            .overallConfidence(totalNodes == 0 ? 0.0 : confidenceSum / totalNodes)
            .itemsNeedingReview(needingReview)
            .autoApprovedItems(autoApproved)
            .build();
    }

    private static AnalysisNode syntheticGroup(String id) {
        return AnalysisNode.builder()
            .id(id)
            .name(SYNTHETIC_GROUP_NAME)
            .type(NodeType.GROUP)
            .tag(ItemTag.UNKNOWN)
            .confidence(SYNTHETIC_GROUP_CONFIDENCE)
            .build();
    }

    private static final class OpenGroup {

        private final AnalysisNode header;
        private final List<AnalysisNode> children = new ArrayList<>();

        OpenGroup(AnalysisNode header) {
            this.header = header;
        }

        AnalysisNode freeze() {
            return header.toBuilder().children(List.copyOf(children)).build();
        }
    }
}
