package com.flightledger.ledger.mapper;

import com.flightledger.ledger.dto.BookingEntry;
import com.flightledger.ledger.dto.FlightLedgerEntry;
import com.flightledger.ledger.model.Booking;
import com.flightledger.ledger.model.FlightLedger;

import java.util.ArrayList;
import java.util.List;

public final class LedgerMapper {

    private LedgerMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightLedgerEntry toEntry(FlightLedger ledger) {
        if (ledger == null) {
            return null;
        }

        return FlightLedgerEntry.builder()
                .flightId(ledger.getId())
                .totalSeats(ledger.getTotalSeats())
                .remainingSeats(ledger.getRemainingSeats())
                .bookedSeats(ledger.getBookedSeats())
                .cancellationPolicy(ledger.getCancellationPolicy().name())
                .bookings(toBookingEntries(ledger.getBookings()))
                .build();
    }

    public static BookingEntry toBookingEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .passengerIdentifier(booking.getPassengerIdentifier())
                .seatCount(booking.getSeatCount())
                .build();
    }

    public static List<BookingEntry> toBookingEntries(List<Booking> bookings) {
        if (bookings == null || bookings.isEmpty()) {
            return new ArrayList<>();
        }

        List<BookingEntry> result = new ArrayList<>(bookings.size());
        for (Booking booking : bookings) {
            result.add(toBookingEntry(booking));
        }
        return result;
    }
}
