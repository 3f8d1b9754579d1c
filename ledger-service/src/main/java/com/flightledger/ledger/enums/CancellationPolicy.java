package com.flightledger.ledger.enums;

/**
 * How a cancellation is applied when no booking matches both passenger and seat count.
 * An exact match is always removed first, whatever the policy.
 */
public enum CancellationPolicy {

    /**
     * Releases the requested seats from the passenger's bookings in insertion order,
     * shrinking or removing entries. Never releases more than the passenger holds.
     */
    PARTIAL,

    /**
     * Rejects the cancellation with {@link LedgerError#SEAT_COUNT_MISMATCH}.
     */
    EXACT_MATCH
}
