package com.sandy.aiot.alert.digest.tools;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds digest ids of the form {recipientUid}_{category}_{YYYY-MM-DD}. Days are UTC.
 */
public final class DigestKeys {
    private static final DateTimeFormatter DAY_FMT = DateTimeFormatter.ISO_LOCAL_DATE;

    private DigestKeys() {
    }

    public static String digestId(String recipientUid, String category, LocalDate day) {
        return recipientUid + "_" + category + "_" + DAY_FMT.format(day);
    }

    public static LocalDate utcDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }
}
