package com.tartaritech.profit_dashboard.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.tartaritech.profit_dashboard.exceptions.InvalidApiKeyException;

/**
 * Checks the X-API-Key header sent by the sync jobs. An empty configured key disables the check.
 */
@Component
public class SyncApiKeyValidator {

    public static final String HEADER = "X-API-Key";

    private final String apiKey;
    private final Logger logger = LoggerFactory.getLogger(SyncApiKeyValidator.class);

    public SyncApiKeyValidator(@Value("${sync.api-key:}") String apiKey) {
        this.apiKey = apiKey;
    }

    public void validate(String providedKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return;
        }
        if (providedKey == null || !MessageDigest.isEqual(
                apiKey.getBytes(StandardCharsets.UTF_8), providedKey.getBytes(StandardCharsets.UTF_8))) {
            logger.warn("Rejected sync push with missing or invalid API key");
            throw new InvalidApiKeyException("Invalid API key");
        }
    }
}
