package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

public class InvalidColumnException extends BusinessException {

    public InvalidColumnException(String column) {
        super(ErrorCode.INVALID_COLUMN, "Invalid column reference: '" + column + "'");
        withMetadata("column", column);
    }
}
