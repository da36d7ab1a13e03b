package com.satyammall.inventoryservice.repository.impl;

import com.google.cloud.Timestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;

/**
 * Conversions for fields that older documents stored with a different type.
 */
final class FirestoreValues {

    private FirestoreValues() {
    }

    static BigDecimal toDecimal(Object raw) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        if (raw instanceof Double || raw instanceof Float) {
            return BigDecimal.valueOf(((Number) raw).doubleValue());
        }
        if (raw instanceof Number) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? BigDecimal.ZERO : new BigDecimal(text);
    }

    static Instant toInstant(Object raw) {
        if (raw instanceof Timestamp) {
            return ((Timestamp) raw).toDate().toInstant();
        }
        if (raw instanceof Date) {
            return ((Date) raw).toInstant();
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            return Instant.parse((String) raw);
        }
        return null;
    }

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
