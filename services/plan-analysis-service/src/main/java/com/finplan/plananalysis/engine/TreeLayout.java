package com.finplan.plananalysis.engine;

import com.finplan.plananalysis.sheet.CellRefs;

/**
 * Where the tree builder reads a sheet: 1-based category and value columns and the
 * first data row.
 */
public record TreeLayout(int categoryColumn, int valueColumn, int startRow) {

    public TreeLayout {
        if (categoryColumn < 1 || valueColumn < 1) {
            throw new IllegalArgumentException("Columns are 1-based");
        }
        if (startRow < 1) {
            startRow = 1;
        }
    }

    public static TreeLayout of(String categoryColumn, String valueColumn, int startRow) {
        return new TreeLayout(CellRefs.columnIndex(categoryColumn), CellRefs.columnIndex(valueColumn), startRow);
    }
}
