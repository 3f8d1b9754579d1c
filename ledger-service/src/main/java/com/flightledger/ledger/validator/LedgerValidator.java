package com.flightledger.ledger.validator;

import com.flightledger.ledger.constants.LedgerConstants;
import com.flightledger.ledger.constants.ValidationMessages;
import com.flightledger.ledger.exception.LedgerValidationException;
import org.springframework.util.StringUtils;

public final class LedgerValidator {

    private LedgerValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlightId(String flightId) {
        if (!StringUtils.hasText(flightId)) {
            throw new LedgerValidationException(ValidationMessages.FLIGHT_ID_REQUIRED);
        }
    }

    public static void validateTotalSeats(int totalSeats) {
        if (totalSeats < LedgerConstants.MIN_SEATS) {
            throw new LedgerValidationException(ValidationMessages.TOTAL_SEATS_MIN);
        }
    }

    public static void validatePassenger(String passengerIdentifier) {
        if (!StringUtils.hasText(passengerIdentifier)) {
            throw new LedgerValidationException(ValidationMessages.PASSENGER_REQUIRED);
        }
    }

    public static void validateSeatCount(int count) {
        if (count < LedgerConstants.MIN_SEATS) {
            throw new LedgerValidationException(ValidationMessages.SEAT_COUNT_POSITIVE);
        }
    }

    public static void validateBookingRequest(String passengerIdentifier, int seatCount) {
        validatePassenger(passengerIdentifier);
        validateSeatCount(seatCount);
    }
}
