package com.finplan.plananalysis.sheet;

import com.finplan.plananalysis.exception.InvalidColumnException;
import org.apache.poi.ss.util.CellReference;

import java.util.regex.Pattern;

/**
 * Conversions between 1-based column indexes, column letters and A1 cell names.
 */
public final class CellRefs {

    private static final Pattern COLUMN_LETTERS = Pattern.compile("^[A-Za-z]{1,3}$");

    private CellRefs() {
    }

    /**
     * "A" -> 1, "AA" -> 27.
     */
    public static int columnIndex(String letters) {
        if (letters == null || !COLUMN_LETTERS.matcher(letters.trim()).matches()) {
            throw new InvalidColumnException(letters);
        }
        return CellReference.convertColStringToIndex(letters.trim().toUpperCase()) + 1;
    }

    /**
     * 1 -> "A", 27 -> "AA".
     */
    public static String columnLetter(int index) {
        if (index <= 0) {
            return "";
        }
        return CellReference.convertNumToColString(index - 1);
    }

    public static String cellName(int column, int row) {
        return columnLetter(column) + row;
    }
}
