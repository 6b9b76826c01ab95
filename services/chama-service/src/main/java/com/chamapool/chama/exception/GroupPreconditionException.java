package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Thrown when the group, period, window or voting state does not allow an operation yet
 * (or any more). Callers may retry after the state changes.
 * Results in HTTP 409 Conflict
 */
public class GroupPreconditionException extends ChamaException {

    public GroupPreconditionException(ErrorCode errorCode) {
        super(errorCode);
    }

    public GroupPreconditionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
