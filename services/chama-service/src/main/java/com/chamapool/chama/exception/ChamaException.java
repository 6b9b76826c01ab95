package com.chamapool.chama.exception;

import com.chamapool.common.exception.BusinessException;
import com.chamapool.common.exception.ErrorCode;

/**
 * Base exception for all chama service exceptions.
 * The HTTP status is derived from the {@link ErrorCode} category.
 */
public class ChamaException extends BusinessException {

    public ChamaException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ChamaException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ChamaException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
