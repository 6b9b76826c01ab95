package com.chamapool.common.exception;

import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base exception for all business-related exceptions.
 *
 * Carries a typed {@link ErrorCode}, a unique error ID for correlation across services,
 * and optional metadata added with the fluent {@link #withMetadata(String, Object)} API.
 *
 * USAGE PATTERNS:
 * 1. Default message: new BusinessException(ErrorCode.XXX)
 * 2. Custom message: new BusinessException(ErrorCode.XXX, "message")
 * 3. With cause: new BusinessException(ErrorCode.XXX, "message", cause)
 * 4. With metadata: new BusinessException(ErrorCode.XXX).withMetadata("key", value)
 */
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
        this.metadata = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add single metadata entry (fluent API)
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
     * Get metadata map (returns unmodifiable view)
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    private static String buildMessage(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            return message != null ? message : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            message != null ? message : errorCode.getDefaultMessage());
    }

    @Override
    public String toString() {
        return String.format("BusinessException[errorId=%s, errorCode=%s, message=%s, metadata=%s, timestamp=%s]",
            errorId, errorCode.getCode(), getMessage(), metadata, timestamp);
    }
}
