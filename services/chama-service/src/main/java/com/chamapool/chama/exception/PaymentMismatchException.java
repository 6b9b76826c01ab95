package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * Thrown when a payment does not carry exactly the required amount in the group's asset.
 * Results in HTTP 400 Bad Request
 */
public class PaymentMismatchException extends ChamaException {

    public PaymentMismatchException(ErrorCode errorCode) {
        super(errorCode);
    }

    public PaymentMismatchException(ErrorCode errorCode, BigDecimal expected, BigDecimal actual) {
        super(errorCode, String.format("%s: expected %s but got %s",
                errorCode.getDefaultMessage(), expected, actual));
    }
}
