package com.finplan.plananalysis.sheet;

import java.util.List;

/**
 * Reads workbook content into sheet snapshots.
 *
 * <p>Implementations throw {@link com.finplan.plananalysis.exception.SheetReadException}
 * when the content cannot be read and
 * {@link com.finplan.plananalysis.exception.SheetNotFoundException} for unknown sheets.
 */
public interface SpreadsheetReader {

    List<String> listSheets(byte[] workbookContent);

    SheetSnapshot readSheet(byte[] workbookContent, String sheetName);

    /**
     * Every readable sheet in workbook order; a sheet that fails to read is left out.
     */
    List<SheetSnapshot> readAllSheets(byte[] workbookContent);
}
