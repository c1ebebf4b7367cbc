package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

/**
 * Thrown when a workbook, a sheet or a row range cannot be read. No partial
 * analysis is ever returned alongside it.
 */
public class SheetReadException extends BusinessException {

    public SheetReadException(String message) {
        super(ErrorCode.SHEET_UNREADABLE, message);
    }

    public SheetReadException(String message, Throwable cause) {
        super(ErrorCode.SHEET_UNREADABLE, message, cause);
    }
}
