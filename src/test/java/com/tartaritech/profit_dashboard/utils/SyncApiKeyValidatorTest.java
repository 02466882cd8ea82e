package com.tartaritech.profit_dashboard.utils;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.tartaritech.profit_dashboard.exceptions.InvalidApiKeyException;

class SyncApiKeyValidatorTest {

    @Test
    void blankConfiguredKeyAcceptsAnything() {
        SyncApiKeyValidator validator = new SyncApiKeyValidator("");

        assertDoesNotThrow(() -> validator.validate(null));
        assertDoesNotThrow(() -> validator.validate("whatever"));
    }

    @Test
    void configuredKeyMustMatch() {
        SyncApiKeyValidator validator = new SyncApiKeyValidator("s3cret");

        assertDoesNotThrow(() -> validator.validate("s3cret"));
        assertThrows(InvalidApiKeyException.class, () -> validator.validate("wrong"));
        assertThrows(InvalidApiKeyException.class, () -> validator.validate(null));
    }
}
