package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

/**
 * The correction store rejected a write. The live predictor is left untouched.
 */
public class CorrectionPersistenceException extends BusinessException {

    public CorrectionPersistenceException(String message, Throwable cause) {
        super(ErrorCode.CORRECTION_PERSISTENCE_FAILED, message, cause);
    }
}
