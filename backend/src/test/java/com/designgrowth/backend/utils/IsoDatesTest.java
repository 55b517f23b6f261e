package com.designgrowth.backend.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IsoDatesTest {

    @Test
    @DisplayName("a calendar date is read as midnight UTC")
    void parsesCalendarDate() {
        assertThat(IsoDates.parse("2025-06-30")).contains(Instant.parse("2025-06-30T00:00:00Z"));
    }

    @Test
    void parsesLocalDateTimeAsUtc() {
        assertThat(IsoDates.parse("2025-06-30T10:15:00")).contains(Instant.parse("2025-06-30T10:15:00Z"));
        assertThat(IsoDates.parse("2025-06-30T10:15")).contains(Instant.parse("2025-06-30T10:15:00Z"));
    }

    @Test
    void acceptsSpaceBetweenDateAndTime() {
        assertThat(IsoDates.parse("2025-06-30 10:15:00")).contains(Instant.parse("2025-06-30T10:15:00Z"));
    }

    @Test
    void honoursExplicitOffset() {
        assertThat(IsoDates.parse("2025-06-30T10:15:00+02:00")).contains(Instant.parse("2025-06-30T08:15:00Z"));
        assertThat(IsoDates.parse("2025-06-30T10:15:00Z")).contains(Instant.parse("2025-06-30T10:15:00Z"));
    }

    @Test
    @DisplayName("anything that is not ISO-8601 yields empty")
    void rejectsNonIsoText() {
        assertThat(IsoDates.parse("next quarter")).isEmpty();
        assertThat(IsoDates.parse("2025-13-01")).isEmpty();
        assertThat(IsoDates.parse("30/06/2025")).isEmpty();
        assertThat(IsoDates.parse("   ")).isEmpty();
        assertThat(IsoDates.parse(null)).isEmpty();
    }
}
