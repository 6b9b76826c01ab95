package com.chamapool.chama.exception;

import com.chamapool.common.exception.ErrorCode;

/**
 * Exception thrown when moving value through the wallet service fails
 * Results in HTTP 502 Bad Gateway
 */
public class ValueTransferException extends ChamaException {

    public ValueTransferException(String message) {
        super(ErrorCode.INT_TRANSFER_FAILED, message);
    }

    public ValueTransferException(String message, Throwable cause) {
        super(ErrorCode.INT_TRANSFER_FAILED, message, cause);
    }

    public ValueTransferException(String operation, String reference, Throwable cause) {
        super(ErrorCode.INT_TRANSFER_FAILED,
                String.format("Wallet %s failed for %s: %s", operation, reference,
                        cause != null ? cause.getMessage() : "no response"),
                cause);
    }
}
