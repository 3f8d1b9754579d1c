package com.flightledger.ledger.model;

import com.flightledger.ledger.constants.ValidationMessages;
import com.flightledger.ledger.enums.CancellationPolicy;
import com.flightledger.ledger.enums.LedgerError;
import com.flightledger.ledger.exception.LedgerValidationException;
import com.flightledger.ledger.util.IdGenerator;
import com.flightledger.ledger.validator.LedgerValidator;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

/**
 * Seat inventory and booking history for a single flight.
 *
 * Invariant: {@code 0 <= remainingSeats <= totalSeats}, and the seats held by
 * {@code bookings} always add up to {@code totalSeats - remainingSeats}.
 *
 * Not thread-safe. Callers sharing a ledger must serialize access themselves.
 */
@Getter
@ToString
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightLedger {

    final String id;
    final int totalSeats;
    final CancellationPolicy cancellationPolicy;
    int remainingSeats;
    boolean closed;

    @Getter(AccessLevel.NONE)
    final List<Booking> bookings = new ArrayList<>();

    private FlightLedger(String id, int totalSeats, CancellationPolicy cancellationPolicy) {
        this.id = id;
        this.totalSeats = totalSeats;
        this.remainingSeats = totalSeats;
        this.cancellationPolicy = cancellationPolicy;
    }

    public static FlightLedger create(int totalSeats) {
        return create(totalSeats, CancellationPolicy.PARTIAL);
    }

    public static FlightLedger create(int totalSeats, CancellationPolicy cancellationPolicy) {
        LedgerValidator.validateTotalSeats(totalSeats);
        if (cancellationPolicy == null) {
            throw new LedgerValidationException(ValidationMessages.CANCELLATION_POLICY_REQUIRED);
        }
        return new FlightLedger(IdGenerator.generateFlightId(), totalSeats, cancellationPolicy);
    }

    // ========== Mutations ==========

    public LedgerResult bookSeats(String passengerIdentifier, int seatCount) {
        LedgerValidator.validateBookingRequest(passengerIdentifier, seatCount);

        if (seatCount > remainingSeats) {
            return LedgerResult.failure(LedgerError.OVERBOOKING);
        }

        bookings.add(new Booking(passengerIdentifier, seatCount));
        remainingSeats -= seatCount;
        return LedgerResult.success(seatCount);
    }

    public LedgerResult cancelBookedSeats(String passengerIdentifier, int cancelSeatCount) {
        LedgerValidator.validateBookingRequest(passengerIdentifier, cancelSeatCount);

        if (indexOfPassenger(passengerIdentifier) < 0) {
            return LedgerResult.failure(LedgerError.BOOKING_NOT_FOUND);
        }

        int exactIndex = indexOfBooking(passengerIdentifier, cancelSeatCount);
        if (exactIndex >= 0) {
            bookings.remove(exactIndex);
            remainingSeats += cancelSeatCount;
            return LedgerResult.success(cancelSeatCount);
        }

        return switch (cancellationPolicy) {
            case EXACT_MATCH -> LedgerResult.failure(LedgerError.SEAT_COUNT_MISMATCH);
            case PARTIAL -> releaseFromPassengerBookings(passengerIdentifier, cancelSeatCount);
        };
    }

    /**
     * Marks the ledger as withdrawn from its registry. Closing is one-way.
     */
    public void close() {
        closed = true;
    }

    // ========== Queries ==========

    public List<Booking> getBookings() {
        return List.copyOf(bookings);
    }

    public int getBookedSeats() {
        return totalSeats - remainingSeats;
    }

    public int getSeatsHeldBy(String passengerIdentifier) {
        int held = 0;
        for (Booking booking : bookings) {
            if (booking.isHeldBy(passengerIdentifier)) {
                held += booking.getSeatCount();
            }
        }
        return held;
    }

    // ========== Private ==========

    private LedgerResult releaseFromPassengerBookings(String passengerIdentifier, int requested) {
        int outstanding = requested;
        ListIterator<Booking> iterator = bookings.listIterator();

        while (outstanding > 0 && iterator.hasNext()) {
            Booking booking = iterator.next();
            if (!booking.isHeldBy(passengerIdentifier)) {
                continue;
            }
            if (booking.getSeatCount() <= outstanding) {
                iterator.remove();
                outstanding -= booking.getSeatCount();
            } else {
                iterator.set(booking.withSeatCount(booking.getSeatCount() - outstanding));
                outstanding = 0;
            }
        }

        int released = requested - outstanding;
        remainingSeats += released;
        return LedgerResult.success(released);
    }

    private int indexOfPassenger(String passengerIdentifier) {
        for (int i = 0; i < bookings.size(); i++) {
            if (bookings.get(i).isHeldBy(passengerIdentifier)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfBooking(String passengerIdentifier, int seatCount) {
        for (int i = 0; i < bookings.size(); i++) {
            if (bookings.get(i).matches(passengerIdentifier, seatCount)) {
                return i;
            }
        }
        return -1;
    }
}
