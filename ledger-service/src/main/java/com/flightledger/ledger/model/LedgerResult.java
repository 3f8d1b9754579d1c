package com.flightledger.ledger.model;

import com.flightledger.ledger.enums.LedgerError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of a booking or cancellation. Failures carry one of the {@link LedgerError} kinds
 * and never mutate the ledger; {@code seats} is the number of seats booked or released.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerResult {

    boolean success;
    LedgerError error;
    int seats;

    public static LedgerResult success(int seats) {
        return new LedgerResult(true, null, seats);
    }

    public static LedgerResult failure(LedgerError error) {
        return new LedgerResult(false, error, 0);
    }

    public boolean isFailure() {
        return !success;
    }

    public boolean hasError(LedgerError kind) {
        return error == kind;
    }

    public Optional<LedgerError> errorKind() {
        return Optional.ofNullable(error);
    }
}
