package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Thrown when the caller lacks the role an operation needs (admin, creator, active member
 * or registry owner).
 * Results in HTTP 403 Forbidden
 */
public class ChamaAuthorizationException extends ChamaException {

    public ChamaAuthorizationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ChamaAuthorizationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
