package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Per-sheet analyses of a workbook in sheet order, plus the best scoring sheet.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkbookAnalysis {

    @Builder.Default
    private final List<SheetAnalysis> sheets = List.of();

    private final String suggestedSheet;
}
