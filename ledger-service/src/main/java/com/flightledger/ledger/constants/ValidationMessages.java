package com.flightledger.ledger.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Flight Validation Messages ==========

    public static final String FLIGHT_ID_REQUIRED = "Flight ID is required";
    public static final String TOTAL_SEATS_MIN = "Total seats must be at least 1";
    public static final String CANCELLATION_POLICY_REQUIRED = "Cancellation policy is required";

    // ========== Booking Validation Messages ==========

    public static final String PASSENGER_REQUIRED = "Passenger identifier is required";
    public static final String SEAT_COUNT_POSITIVE = "Seat count must be positive";
}
