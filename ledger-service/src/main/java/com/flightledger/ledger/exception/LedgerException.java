package com.flightledger.ledger.exception;

import lombok.Getter;


@Getter
public class LedgerException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public LedgerException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public LedgerException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public LedgerException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
