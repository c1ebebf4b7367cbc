package com.finplan.common.exception;

import org.springframework.http.HttpStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related failures in FinPlan services.
 *
 * Carries a unique error id for log correlation, an {@link ErrorCode} that fixes
 * the HTTP status, and a metadata map that callers may enrich after construction:
 * <pre>
 * throw new BusinessException(ErrorCode.SHEET_UNREADABLE, "Sheet is empty")
 *     .withMetadata("sheetName", sheetName);
 * </pre>
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final LocalDateTime timestamp;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYSTEM_ERROR;
        this.metadata = new HashMap<>();
        this.timestamp = LocalDateTime.now();
    }

    /**
     * Add single metadata entry (fluent API). Null keys and values are ignored.
     */
    public BusinessException withMetadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public String getErrorId() {
        return errorId;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Unmodifiable view; use {@link #withMetadata(String, Object)} to add entries.
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }

    /**
     * Convert to error response DTO for API responses
     */
    public ErrorResponse toErrorResponse() {
        return ErrorResponse.builder()
            .errorId(errorId)
            .status(getStatus().value())
            .error(errorCode.getCode())
            .message(getMessage())
            .timestamp(timestamp)
            .details(metadata.isEmpty() ? null : getMetadata())
            .build();
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorId=%s, errorCode=%s, message=%s, metadata=%s, timestamp=%s]",
            errorId, errorCode.getCode(), getMessage(), metadata, timestamp);
    }
}
