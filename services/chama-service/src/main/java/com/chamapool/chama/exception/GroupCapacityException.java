package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Thrown when a group is full, a payout queue is misconfigured or a creator owns too many groups.
 * Results in HTTP 422 Unprocessable Entity
 */
public class GroupCapacityException extends ChamaException {

    public GroupCapacityException(ErrorCode errorCode) {
        super(errorCode);
    }

    public GroupCapacityException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
