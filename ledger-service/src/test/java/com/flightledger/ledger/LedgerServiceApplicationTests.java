package com.flightledger.ledger;

import com.flightledger.ledger.config.LedgerProperties;
import com.flightledger.ledger.enums.CancellationPolicy;
import com.flightledger.ledger.enums.LedgerError;
import com.flightledger.ledger.service.FlightLedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "ledger.cancellation-policy=EXACT_MATCH",
        "ledger.lock.wait-timeout=2s"
})
@DisplayName("LedgerServiceApplication")
class LedgerServiceApplicationTests {

    @Autowired
    private LedgerProperties properties;

    @Autowired
    private FlightLedgerService ledgerService;

    @Test
    @DisplayName("binds ledger properties")
    void bindsProperties() {
        assertThat(properties.getCancellationPolicy()).isEqualTo(CancellationPolicy.EXACT_MATCH);
        assertThat(properties.getLock().getWaitTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getMaxFlights()).isEqualTo(1000);
    }

    @Test
    @DisplayName("wires the ledger service with the configured policy")
    void wiresService() {
        String flightId = ledgerService.createFlight(10).getFlightId();
        ledgerService.bookSeats(flightId, "Alice", 4);

        assertThat(ledgerService.cancelBookedSeats(flightId, "Alice", 2).getError())
                .isEqualTo(LedgerError.SEAT_COUNT_MISMATCH);
        assertThat(ledgerService.getRemainingSeats(flightId)).isEqualTo(6);
    }
}
