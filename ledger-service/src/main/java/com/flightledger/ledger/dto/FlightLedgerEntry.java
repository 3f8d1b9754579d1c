package com.flightledger.ledger.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightLedgerEntry {

    String flightId;

    Integer totalSeats;

    Integer remainingSeats;

    Integer bookedSeats;

    String cancellationPolicy;

    List<BookingEntry> bookings;
}
