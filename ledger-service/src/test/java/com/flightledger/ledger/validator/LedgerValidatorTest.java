package com.flightledger.ledger.validator;

import com.flightledger.ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LedgerValidator")
class LedgerValidatorTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\t"})
    @DisplayName("rejects blank passenger identifiers")
    void rejectsBlankPassenger(String passenger) {
        assertThatThrownBy(() -> LedgerValidator.validatePassenger(passenger))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessage("Passenger identifier is required");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @DisplayName("rejects blank flight ids")
    void rejectsBlankFlightId(String flightId) {
        assertThatThrownBy(() -> LedgerValidator.validateFlightId(flightId))
                .isInstanceOf(LedgerValidationException.class)
                .hasMessage("Flight ID is required");
    }

    @Test
    @DisplayName("carries the validation error code")
    void carriesErrorCode() {
        assertThatThrownBy(() -> LedgerValidator.validateSeatCount(0))
                .isInstanceOf(LedgerValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "VALIDATION_ERROR")
                .hasFieldOrPropertyWithValue("retryable", false);
    }

    @Test
    @DisplayName("accepts a valid booking request")
    void acceptsValidRequest() {
        assertThatCode(() -> LedgerValidator.validateBookingRequest("alice@example.com", 1))
                .doesNotThrowAnyException();
    }
}
