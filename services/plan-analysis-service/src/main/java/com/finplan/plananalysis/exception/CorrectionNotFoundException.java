package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

public class CorrectionNotFoundException extends BusinessException {

    public CorrectionNotFoundException(String term) {
        super(ErrorCode.CORRECTION_NOT_FOUND, "No correction stored for term '" + term + "'");
        withMetadata("term", term);
    }
}
