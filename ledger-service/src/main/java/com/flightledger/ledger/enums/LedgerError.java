package com.flightledger.ledger.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LedgerError {

    OVERBOOKING("overbooking", "Requested seats exceed remaining seats"),
    BOOKING_NOT_FOUND("not_found", "No booking found for passenger"),
    SEAT_COUNT_MISMATCH("seat_mismatch", "No booking matches the requested seat count");

    private final String metricTag;
    private final String description;
}
