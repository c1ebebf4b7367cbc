package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

import java.util.List;

public class SheetNotFoundException extends BusinessException {

    public SheetNotFoundException(String sheetName, List<String> availableSheets) {
        super(ErrorCode.SHEET_NOT_FOUND, "Sheet '" + sheetName + "' not found in workbook");
        withMetadata("sheetName", sheetName);
        withMetadata("availableSheets", availableSheets);
    }
}
