package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Exception thrown when group creation parameters are outside the registry bounds
 * Results in HTTP 400 Bad Request
 */
public class InvalidGroupParametersException extends ChamaException {

    public InvalidGroupParametersException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvalidGroupParametersException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
