package com.flightledger.ledger.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LedgerProperties")
class LedgerPropertiesTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("accepts the defaults")
    void acceptsDefaults() {
        assertThat(validator.validate(new LedgerProperties())).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(longs = {0, -1})
    @DisplayName("rejects a lock wait timeout that is not positive")
    void rejectsNonPositiveWaitTimeout(long millis) {
        LedgerProperties properties = new LedgerProperties();
        properties.getLock().setWaitTimeout(Duration.ofMillis(millis));

        Set<ConstraintViolation<LedgerProperties>> violations = validator.validate(properties);

        assertThat(violations)
                .extracting(ConstraintViolation::getMessage)
                .containsExactly("ledger.lock.wait-timeout must be positive");
    }

    @Test
    @DisplayName("rejects a max flights below one")
    void rejectsZeroMaxFlights() {
        LedgerProperties properties = new LedgerProperties();
        properties.setMaxFlights(0);

        assertThat(validator.validate(properties)).hasSize(1);
    }
}
