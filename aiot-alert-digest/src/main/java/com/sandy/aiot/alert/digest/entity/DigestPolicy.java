package com.sandy.aiot.alert.digest.entity;

import java.time.Duration;

/**
 * Fixed limits of the digest model.
 */
public final class DigestPolicy {
    public static final int MAX_ITEMS = 10;
    public static final int MAX_SEND_ATTEMPTS = 3;
    public static final Duration COOLDOWN = Duration.ofHours(24);
    /** Catch-all category for anything the categorizer cannot place. */
    public static final String FALLBACK_CATEGORY = "multi_param";

    private DigestPolicy() {
    }
}
