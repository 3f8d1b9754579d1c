package com.flightledger.ledger.config;

import com.flightledger.ledger.constants.LedgerConstants;
import com.flightledger.ledger.enums.CancellationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code ledger.*} settings from application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @NotNull
    private CancellationPolicy cancellationPolicy = CancellationPolicy.PARTIAL;

    @Min(1)
    private int maxFlights = LedgerConstants.DEFAULT_MAX_FLIGHTS;

    @Valid
    @NotNull
    private Lock lock = new Lock();

    @Data
    public static class Lock {

        @NotNull
        private Duration waitTimeout = Duration.ofSeconds(LedgerConstants.DEFAULT_LOCK_WAIT_SECONDS);

        @AssertTrue(message = "ledger.lock.wait-timeout must be positive")
        public boolean isWaitTimeoutPositive() {
            return waitTimeout == null || (!waitTimeout.isNegative() && !waitTimeout.isZero());
        }
    }
}
