package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Thrown on double execution, double payout or an unknown or invalid target.
 * Results in HTTP 409 Conflict
 */
public class GroupIntegrityException extends ChamaException {

    public GroupIntegrityException(ErrorCode errorCode) {
        super(errorCode);
    }

    public GroupIntegrityException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
