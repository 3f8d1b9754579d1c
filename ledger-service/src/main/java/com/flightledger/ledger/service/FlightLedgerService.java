package com.flightledger.ledger.service;

import com.flightledger.ledger.config.LedgerProperties;
import com.flightledger.ledger.constants.LedgerConstants;
import com.flightledger.ledger.dto.BookingEntry;
import com.flightledger.ledger.dto.FlightLedgerEntry;
import com.flightledger.ledger.exception.FlightNotFoundException;
import com.flightledger.ledger.exception.LedgerOperationException;
import com.flightledger.ledger.mapper.LedgerMapper;
import com.flightledger.ledger.model.FlightLedger;
import com.flightledger.ledger.model.LedgerResult;
import com.flightledger.ledger.service.lock.LockOperations;
import com.flightledger.ledger.validator.LedgerValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory registry of flight ledgers.
 *
 * The registry map is guarded by a read/write lock; each ledger is only touched
 * while holding its per-flight lock from {@link LockOperations}. Removal closes the
 * ledger under that lock, so operations that looked it up earlier fail as not found.
 */
@Service
@Slf4j
public class FlightLedgerService {

    private final LockOperations lockOperations;
    private final MeterRegistry meterRegistry;
    private final LedgerProperties properties;

    private final Map<String, FlightLedger> ledgers;
    private final ReadWriteLock registryLock;

    public FlightLedgerService(LockOperations lockOperations, MeterRegistry meterRegistry,
                               LedgerProperties properties) {
        this.lockOperations = lockOperations;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.ledgers = new LinkedHashMap<>();
        this.registryLock = new ReentrantReadWriteLock();
    }

    // ========== Registry Operations ==========

    public FlightLedgerEntry createFlight(int totalSeats) {
        LedgerValidator.validateTotalSeats(totalSeats);

        FlightLedger ledger;
        FlightLedgerEntry entry;
        registryLock.writeLock().lock();
        try {
            if (ledgers.size() >= properties.getMaxFlights()) {
                log.warn("Flight limit reached: maxFlights={}", properties.getMaxFlights());
                throw LedgerOperationException.flightLimitReached(properties.getMaxFlights());
            }
            ledger = FlightLedger.create(totalSeats, properties.getCancellationPolicy());
            while (ledgers.containsKey(ledger.getId())) {
                log.debug("Flight id collision, regenerating: id={}", ledger.getId());
                ledger = FlightLedger.create(totalSeats, properties.getCancellationPolicy());
            }
            entry = LedgerMapper.toEntry(ledger);
            ledgers.put(ledger.getId(), ledger);
        } finally {
            registryLock.writeLock().unlock();
        }

        log.info("Created flight ledger: id={}, totalSeats={}, policy={}",
                ledger.getId(), totalSeats, ledger.getCancellationPolicy());
        return entry;
    }

    public void removeFlight(String flightId) {
        LedgerValidator.validateFlightId(flightId);

        executeOnLedger(flightId, ledger -> {
            registryLock.writeLock().lock();
            try {
                ledgers.remove(flightId, ledger);
            } finally {
                registryLock.writeLock().unlock();
            }
            ledger.close();
            return null;
        });

        lockOperations.discardLock(flightId);
        log.info("Removed flight ledger: id={}", flightId);
    }

    // ========== Seat Operations ==========

    public LedgerResult bookSeats(String flightId, String passengerIdentifier, int seatCount) {
        LedgerValidator.validateFlightId(flightId);
        LedgerValidator.validateBookingRequest(passengerIdentifier, seatCount);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            LedgerResult result = executeLocked(flightId, LedgerConstants.METRIC_BOOK_TOTAL,
                    ledger -> ledger.bookSeats(passengerIdentifier, seatCount));

            recordOutcome(LedgerConstants.METRIC_BOOK_TOTAL, result);
            if (result.isSuccess()) {
                log.info("Seats booked: flightId={}, passenger={}, seats={}",
                        flightId, passengerIdentifier, seatCount);
            } else {
                log.warn("Booking rejected: flightId={}, passenger={}, requested={}, error={} ({})",
                        flightId, passengerIdentifier, seatCount, result.getError(),
                        result.getError().getDescription());
            }
            return result;
        } finally {
            sample.stop(Timer.builder(LedgerConstants.METRIC_BOOK_DURATION).register(meterRegistry));
        }
    }

    public LedgerResult cancelBookedSeats(String flightId, String passengerIdentifier, int cancelSeatCount) {
        LedgerValidator.validateFlightId(flightId);
        LedgerValidator.validateBookingRequest(passengerIdentifier, cancelSeatCount);

        LedgerResult result = executeLocked(flightId, LedgerConstants.METRIC_CANCEL_TOTAL,
                ledger -> ledger.cancelBookedSeats(passengerIdentifier, cancelSeatCount));

        recordOutcome(LedgerConstants.METRIC_CANCEL_TOTAL, result);
        if (result.isFailure()) {
            log.warn("Cancellation rejected: flightId={}, passenger={}, requested={}, error={} ({})",
                    flightId, passengerIdentifier, cancelSeatCount, result.getError(),
                    result.getError().getDescription());
        } else if (result.getSeats() < cancelSeatCount) {
            log.warn("Cancellation capped at held seats: flightId={}, passenger={}, requested={}, released={}",
                    flightId, passengerIdentifier, cancelSeatCount, result.getSeats());
        } else {
            log.info("Seats cancelled: flightId={}, passenger={}, seats={}",
                    flightId, passengerIdentifier, result.getSeats());
        }
        return result;
    }

    // ========== Query Operations ==========

    public int getRemainingSeats(String flightId) {
        LedgerValidator.validateFlightId(flightId);
        return executeOnLedger(flightId, FlightLedger::getRemainingSeats);
    }

    public List<BookingEntry> getBookings(String flightId) {
        LedgerValidator.validateFlightId(flightId);
        return executeOnLedger(flightId, ledger -> LedgerMapper.toBookingEntries(ledger.getBookings()));
    }

    public FlightLedgerEntry getFlight(String flightId) {
        LedgerValidator.validateFlightId(flightId);
        return executeOnLedger(flightId, LedgerMapper::toEntry);
    }

    public List<FlightLedgerEntry> getAllFlights() {
        List<FlightLedger> snapshot;
        registryLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(ledgers.values());
        } finally {
            registryLock.readLock().unlock();
        }

        List<FlightLedgerEntry> result = new ArrayList<>(snapshot.size());
        for (FlightLedger ledger : snapshot) {
            // removed after the snapshot was taken
            FlightLedgerEntry entry = lockOperations.executeWithLock(ledger.getId(),
                    () -> ledger.isClosed() ? null : LedgerMapper.toEntry(ledger));
            if (entry != null) {
                result.add(entry);
            } else {
                lockOperations.discardLock(ledger.getId());
            }
        }
        return result;
    }

    public int getFlightCount() {
        registryLock.readLock().lock();
        try {
            return ledgers.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    // ========== Private ==========

    private FlightLedger findLedgerOrThrow(String flightId) {
        registryLock.readLock().lock();
        try {
            FlightLedger ledger = ledgers.get(flightId);
            if (ledger == null) {
                throw new FlightNotFoundException(flightId);
            }
            return ledger;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Runs action on the registered ledger while holding its flight lock. A ledger closed by
     * {@link #removeFlight} between lookup and lock acquisition is reported as not found, and
     * the lock re-created by the late caller is discarded again.
     */
    private <T> T executeOnLedger(String flightId, Function<FlightLedger, T> action) {
        FlightLedger ledger = findLedgerOrThrow(flightId);
        try {
            return lockOperations.executeWithLock(flightId, () -> {
                if (ledger.isClosed()) {
                    throw new FlightNotFoundException(flightId);
                }
                return action.apply(ledger);
            });
        } catch (FlightNotFoundException e) {
            lockOperations.discardLock(flightId);
            throw e;
        }
    }

    private LedgerResult executeLocked(String flightId, String metricName,
                                       Function<FlightLedger, LedgerResult> action) {
        try {
            return executeOnLedger(flightId, action);
        } catch (LockOperations.LockAcquisitionException e) {
            meterRegistry.counter(metricName, LedgerConstants.METRIC_TAG_RESULT,
                    LedgerConstants.RESULT_LOCK_FAILED).increment();
            log.warn("Failed to acquire lock: flightId={}, error={}", flightId, e.getMessage());
            throw LedgerOperationException.lockFailed(flightId, e);
        }
    }

    private void recordOutcome(String metricName, LedgerResult result) {
        String tag = result.isSuccess()
                ? LedgerConstants.RESULT_SUCCESS
                : result.getError().getMetricTag();
        meterRegistry.counter(metricName, LedgerConstants.METRIC_TAG_RESULT, tag).increment();
    }
}
