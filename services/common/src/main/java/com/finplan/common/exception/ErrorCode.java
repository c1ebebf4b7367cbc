package com.finplan.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by FinPlan services
 * Format: MODULE_SPECIFIC_ERROR
 */
public enum ErrorCode {

    // ===== VALIDATION ERRORS (VAL_XXX) =====
    VALIDATION_FAILED("VAL_001", "Request validation failed", HttpStatus.BAD_REQUEST),
    INVALID_TAG("VAL_002", "Unknown item tag", HttpStatus.BAD_REQUEST),
    INVALID_TERM("VAL_003", "Correction term must not be blank", HttpStatus.BAD_REQUEST),
    INVALID_COLUMN("VAL_004", "Invalid spreadsheet column reference", HttpStatus.BAD_REQUEST),

    // ===== SPREADSHEET ERRORS (SHEET_XXX) =====
    SHEET_UNREADABLE("SHEET_001", "Spreadsheet could not be read", HttpStatus.UNPROCESSABLE_ENTITY),
    SHEET_NOT_FOUND("SHEET_002", "Sheet not found in workbook", HttpStatus.NOT_FOUND),

    // ===== CORRECTION ERRORS (CORR_XXX) =====
    CORRECTION_PERSISTENCE_FAILED("CORR_001", "Correction could not be saved", HttpStatus.SERVICE_UNAVAILABLE),
    CORRECTION_HYDRATION_FAILED("CORR_002", "Corrections could not be loaded", HttpStatus.SERVICE_UNAVAILABLE),
    CORRECTION_NOT_FOUND("CORR_003", "Correction not found", HttpStatus.NOT_FOUND),

    // ===== SYSTEM ERRORS (SYS_XXX) =====
    SYSTEM_ERROR("SYS_001", "Internal system error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
