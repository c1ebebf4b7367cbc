package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

/**
 * A correction request carrying a blank term or an unknown tag code.
 */
public class InvalidCorrectionException extends BusinessException {

    public InvalidCorrectionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static InvalidCorrectionException blankTerm() {
        return new InvalidCorrectionException(ErrorCode.INVALID_TERM, null);
    }

    public static InvalidCorrectionException unknownTag(String tag) {
        InvalidCorrectionException ex = new InvalidCorrectionException(ErrorCode.INVALID_TAG,
            "Unknown item tag '" + tag + "', expected one of B, R, S, IN, D");
        ex.withMetadata("tag", tag);
        return ex;
    }
}
