package com.sandy.aiot.alert.digest.tools;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DigestKeysTest {

    @Test
    void idJoinsRecipientCategoryAndIsoDay() {
        assertEquals("u1_ph_high_2024-05-01", DigestKeys.digestId("u1", "ph_high", LocalDate.of(2024, 5, 1)));
    }

    @Test
    void dayIsTakenInUtc() {
        assertEquals(LocalDate.of(2024, 5, 1), DigestKeys.utcDay(Instant.parse("2024-05-01T23:59:59Z")));
        assertEquals(LocalDate.of(2024, 5, 2), DigestKeys.utcDay(Instant.parse("2024-05-02T00:00:00Z")));
    }
}
