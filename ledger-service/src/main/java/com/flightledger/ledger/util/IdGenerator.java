package com.flightledger.ledger.util;

import com.flightledger.ledger.constants.LedgerConstants;

import java.util.UUID;

public final class IdGenerator {

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateFlightId() {
        return LedgerConstants.FLIGHT_ID_PREFIX + UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, LedgerConstants.FLIGHT_ID_SUFFIX_LENGTH)
                .toUpperCase();
    }
}
