package com.designgrowth.backend.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * ISO-8601 parsing for client supplied dates. Values without an offset are read as UTC.
 */
public final class IsoDates {

    private IsoDates() {
    }

    /**
     * Parses a calendar date ({@code 2025-06-30}), a local date-time ({@code 2025-06-30T10:15:00},
     * a space separator is accepted too) or an offset date-time ({@code 2025-06-30T10:15:00+02:00}).
     *
     * @return the instant, or empty when the text is not ISO-8601
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        try {
            if (value.length() == 10) {
                return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException localFailure) {
            try {
                return Optional.of(OffsetDateTime.parse(value).toInstant());
            } catch (DateTimeParseException offsetFailure) {
                return Optional.empty();
            }
        }
    }
}
