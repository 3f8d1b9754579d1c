package com.flightledger.ledger.exception;

/**
 * Thrown when a registry operation cannot be carried out (lock timeout, capacity).
 * Overbooking and missing bookings are result values, not exceptions.
 */
public class LedgerOperationException extends LedgerException {

    public LedgerOperationException(String errorCode, String message, boolean retryable) {
        super(errorCode, message, retryable);
    }

    public LedgerOperationException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(errorCode, message, retryable, cause);
    }

    public static LedgerOperationException lockFailed(String flightId, Throwable cause) {
        return new LedgerOperationException("LOCK_FAILED",
                "Could not acquire lock for flight: " + flightId, true, cause);
    }

    public static LedgerOperationException flightLimitReached(int maxFlights) {
        return new LedgerOperationException("FLIGHT_LIMIT_REACHED",
                "Flight limit reached: " + maxFlights, false);
    }
}
