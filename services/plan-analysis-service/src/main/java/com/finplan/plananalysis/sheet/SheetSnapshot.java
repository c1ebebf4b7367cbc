package com.finplan.plananalysis.sheet;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, fully materialized view of one sheet.
 *
 * <p>Rows and columns are addressed 1-based, the way spreadsheet users see them.
 * Cell text is kept exactly as formatted by the reader (leading spaces included);
 * cells beyond the end of a row read as the empty string.
 */
public final class SheetSnapshot {

    @Getter
    private final String sheetName;
    private final List<List<String>> rows;
    private final Map<String, String> formulas;
    private final Map<String, Integer> styles;

    private SheetSnapshot(String sheetName, List<List<String>> rows,
                          Map<String, String> formulas, Map<String, Integer> styles) {
        this.sheetName = sheetName;
        this.rows = rows;
        this.formulas = formulas;
        this.styles = styles;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public String cellText(int row, int column) {
        if (row < 1 || row > rows.size() || column < 1) {
            return "";
        }
        List<String> cells = rows.get(row - 1);
        return column <= cells.size() ? cells.get(column - 1) : "";
    }

    /**
     * Formula text of a cell without the leading '=', or the empty string.
     */
    public String formulaAt(int row, int column) {
        return formulas.getOrDefault(CellRefs.cellName(column, row), "");
    }

    /**
     * Number of formula cells in the whole sheet.
     */
    public int getFormulaCount() {
        return formulas.size();
    }

    /**
     * Style identifier of a cell; 0 for cells without emphasis.
     */
    public int styleAt(int row, int column) {
        return styles.getOrDefault(CellRefs.cellName(column, row), 0);
    }

    public static Builder builder(String sheetName) {
        return new Builder(sheetName);
    }

    public static final class Builder {

        private final String sheetName;
        private final List<List<String>> rows = new ArrayList<>();
        private final Map<String, String> formulas = new HashMap<>();
        private final Map<String, Integer> styles = new HashMap<>();

        private Builder(String sheetName) {
            this.sheetName = sheetName;
        }

        public Builder row(String... cells) {
            return row(Arrays.asList(cells));
        }

        public Builder row(List<String> cells) {
            List<String> copy = new ArrayList<>(cells.size());
            for (String cell : cells) {
                copy.add(cell == null ? "" : cell);
            }
            rows.add(List.copyOf(copy));
            return this;
        }

        public Builder formula(String cellName, String formula) {
            if (formula != null && !formula.isEmpty()) {
                formulas.put(cellName.toUpperCase(), formula);
            }
            return this;
        }

        public Builder style(String cellName, int styleId) {
            if (styleId != 0) {
                styles.put(cellName.toUpperCase(), styleId);
            }
            return this;
        }

        public SheetSnapshot build() {
            return new SheetSnapshot(sheetName, List.copyOf(rows), Map.copyOf(formulas), Map.copyOf(styles));
        }
    }
}
