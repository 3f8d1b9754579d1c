package com.flightledger.ledger.exception;


public class LedgerValidationException extends LedgerException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public LedgerValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
