package com.finplan.plananalysis.profile;

import com.finplan.plananalysis.model.ColumnProfile;
import com.finplan.plananalysis.sheet.CellRefs;
import com.finplan.plananalysis.sheet.NumericValues;
import com.finplan.plananalysis.sheet.SheetSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes per-column statistics over the sampled rows of a sheet.
 *
 * <p>The first {@value #HEADER_GUARD_ROWS} rows are skipped as a header guard before
 * counting. Every density, the unique ratio included, is normalized by the number of
 * rows actually analyzed after the guard; when nothing is left to analyze the
 * divisor is 1 and all densities stay at zero.
 */
@Slf4j
@Component
public class ColumnProfiler {

    public static final int HEADER_GUARD_ROWS = 4;

    public List<ColumnProfile> profile(SheetSnapshot sheet, int maxRows) {
        int sampled = sampleBound(sheet.getRowCount(), maxRows);

        int columns = 0;
        for (int row = 1; row <= sampled; row++) {
            columns = Math.max(columns, sheet.getRows().get(row - 1).size());
        }

        int firstRow = HEADER_GUARD_ROWS + 1;
        int rowsAnalyzed = Math.max(1, sampled - HEADER_GUARD_ROWS);

        List<ColumnProfile> profiles = new ArrayList<>(columns);
        for (int column = 1; column <= columns; column++) {
            ColumnCounts counts = new ColumnCounts();
            for (int row = firstRow; row <= sampled; row++) {
                counts.add(sheet.cellText(row, column).trim(), !sheet.formulaAt(row, column).isEmpty());
            }
            profiles.add(counts.toProfile(column, rowsAnalyzed));
        }

        log.debug("Profiled {} columns of sheet '{}' over {} sampled rows",
            columns, sheet.getSheetName(), sampled);
        return profiles;
    }

    /**
     * Rows to sample: all of them when {@code maxRows} is not positive or exceeds the sheet.
     */
    public static int sampleBound(int rowCount, int maxRows) {
        return maxRows <= 0 || maxRows > rowCount ? rowCount : maxRows;
    }

    private static final class ColumnCounts {

        private int numeric;
        private int formula;
        private int empty;
        private int text;
        private long textLength;
        private int nonEmpty;
        private final Set<String> distinct = new HashSet<>();

        void add(String value, boolean hasFormula) {
            if (value.isEmpty()) {
                empty++;
            } else {
                nonEmpty++;
                distinct.add(value);
                textLength += value.length();
                if (NumericValues.isNumeric(value)) {
                    numeric++;
                } else {
                    text++;
                }
            }
            if (hasFormula) {
                formula++;
            }
        }

        ColumnProfile toProfile(int column, int rowsAnalyzed) {
            double divisor = rowsAnalyzed;
            return ColumnProfile.builder()
                .index(column)
                .letter(CellRefs.columnLetter(column))
                .numericDensity(numeric / divisor)
                .formulaDensity(formula / divisor)
                .emptyDensity(empty / divisor)
                .textDensity(text / divisor)
                .uniqueRatio(distinct.size() / divisor)
                .avgTextLength(nonEmpty == 0 ? 0.0 : (double) textLength / nonEmpty)
                .build();
        }
    }
}
