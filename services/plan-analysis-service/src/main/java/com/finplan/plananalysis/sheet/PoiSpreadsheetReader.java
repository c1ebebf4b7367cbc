package com.finplan.plananalysis.sheet;

import com.finplan.common.exception.BusinessException;
import com.finplan.plananalysis.exception.SheetNotFoundException;
import com.finplan.plananalysis.exception.SheetReadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Apache POI backed reader for .xlsx and .xls workbooks.
 *
 * <p>Cells are rendered through {@link DataFormatter} so the text matches what the
 * user sees in the spreadsheet. Formula cells yield their cached result as text and
 * their formula separately; formulas are never re-evaluated.
 */
@Slf4j
@Component
public class PoiSpreadsheetReader implements SpreadsheetReader {

    @Override
    public List<String> listSheets(byte[] workbookContent) {
        try (Workbook workbook = open(workbookContent)) {
            List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw new SheetReadException("Failed to close workbook", e);
        }
    }

    @Override
    public SheetSnapshot readSheet(byte[] workbookContent, String sheetName) {
        try (Workbook workbook = open(workbookContent)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                List<String> available = new ArrayList<>();
                workbook.forEach(s -> available.add(s.getSheetName()));
                throw new SheetNotFoundException(sheetName, available);
            }
            SheetSnapshot snapshot = snapshot(sheet);
            log.debug("Read sheet '{}': {} rows", sheetName, snapshot.getRowCount());
            return snapshot;
        } catch (IOException e) {
            throw new SheetReadException("Failed to close workbook", e);
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SheetReadException("Failed to read sheet '" + sheetName + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<SheetSnapshot> readAllSheets(byte[] workbookContent) {
        try (Workbook workbook = open(workbookContent)) {
            List<SheetSnapshot> snapshots = new ArrayList<>(workbook.getNumberOfSheets());
            for (Sheet sheet : workbook) {
                try {
                    snapshots.add(snapshot(sheet));
                } catch (RuntimeException e) {
                    log.warn("Skipping unreadable sheet '{}': {}", sheet.getSheetName(), e.getMessage(), e);
                }
            }
            log.debug("Read {} of {} sheets", snapshots.size(), workbook.getNumberOfSheets());
            return snapshots;
        } catch (IOException e) {
            throw new SheetReadException("Failed to close workbook", e);
        }
    }

    private Workbook open(byte[] workbookContent) {
        if (workbookContent == null || workbookContent.length == 0) {
            throw new SheetReadException("Workbook content is empty");
        }
        try {
            return WorkbookFactory.create(new ByteArrayInputStream(workbookContent));
        } catch (IOException | RuntimeException e) {
            throw new SheetReadException("Unreadable workbook: " + e.getMessage(), e);
        }
    }

    private SheetSnapshot snapshot(Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        SheetSnapshot.Builder builder = SheetSnapshot.builder(sheet.getSheetName());

        List<List<String>> rows = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<String> cells = new ArrayList<>();
            if (row != null && row.getLastCellNum() > 0) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                    if (cell == null) {
                        cells.add("");
                        continue;
                    }
                    cells.add(cellText(cell, formatter));
                    String name = CellRefs.cellName(c + 1, r + 1);
                    if (cell.getCellType() == CellType.FORMULA) {
                        builder.formula(name, cell.getCellFormula());
                    }
                    builder.style(name, styleId(sheet.getWorkbook(), cell));
                }
            }
            rows.add(trimTrailing(cells));
        }

        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) {
            rows.remove(rows.size() - 1);
        }
        rows.forEach(builder::row);
        return builder.build();
    }

    /**
     * Non-zero only for bold cells. The default style index differs between formats
     * (0 in .xlsx, 15 in .xls), so the raw index alone says nothing about emphasis.
     */
    private static int styleId(Workbook workbook, Cell cell) {
        CellStyle style = cell.getCellStyle();
        if (!workbook.getFontAt(style.getFontIndex()).getBold()) {
            return 0;
        }
        return style.getIndex() + 1;
    }

    private String cellText(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }
        CellStyle style = cell.getCellStyle();
        switch (cell.getCachedFormulaResultType()) {
            case NUMERIC:
                return formatter.formatRawCellContents(cell.getNumericCellValue(),
                    style.getDataFormat(), style.getDataFormatString());
            case STRING:
                return cell.getStringCellValue();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue()).toUpperCase();
            default:
                return "";
        }
    }

    private List<String> trimTrailing(List<String> cells) {
        int end = cells.size();
        while (end > 0 && cells.get(end - 1).isEmpty()) {
            end--;
        }
        return cells.subList(0, end);
    }
}
