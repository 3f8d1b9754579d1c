package com.flightledger.ledger.exception;

/**
 * Thrown when no ledger is registered under the requested flight id.
 */
public class FlightNotFoundException extends LedgerException {

    private static final String ERROR_CODE = "FLIGHT_NOT_FOUND";

    public FlightNotFoundException(String flightId) {
        super(ERROR_CODE, "Flight not found: " + flightId);
    }
}
