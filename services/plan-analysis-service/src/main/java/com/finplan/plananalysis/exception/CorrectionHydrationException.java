package com.finplan.plananalysis.exception;

import com.finplan.common.exception.BusinessException;
import com.finplan.common.exception.ErrorCode;

import java.util.UUID;

/**
 * The correction store could not be read while hydrating a user's overlay.
 * Baseline and global predictor layers stay usable.
 */
public class CorrectionHydrationException extends BusinessException {

    public CorrectionHydrationException(UUID userId, Throwable cause) {
        super(ErrorCode.CORRECTION_HYDRATION_FAILED, "Failed to load corrections for user " + userId, cause);
        withMetadata("userId", userId);
    }
}
