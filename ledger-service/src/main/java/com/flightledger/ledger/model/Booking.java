package com.flightledger.ledger.model;

import lombok.Value;
import lombok.With;

/**
 * One passenger's reservation of some seats on a flight. Equality is by value.
 */
@Value
public class Booking {

    String passengerIdentifier;

    @With
    int seatCount;

    public boolean isHeldBy(String passenger) {
        return passengerIdentifier.equals(passenger);
    }

    public boolean matches(String passenger, int seats) {
        return isHeldBy(passenger) && seatCount == seats;
    }
}
