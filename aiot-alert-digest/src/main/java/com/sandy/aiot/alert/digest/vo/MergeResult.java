package com.sandy.aiot.alert.digest.vo;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of folding one alert into its digest.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class MergeResult {
    public enum Status { CREATED, MERGED, DUPLICATE, REJECTED, STORE_UNAVAILABLE }

    private final Status status;
    private final AlertDigest digest;
    private final String message;

    public static MergeResult created(AlertDigest digest) { return new MergeResult(Status.CREATED, digest, null); }
    public static MergeResult merged(AlertDigest digest) { return new MergeResult(Status.MERGED, digest, null); }
    public static MergeResult duplicate(AlertDigest digest) { return new MergeResult(Status.DUPLICATE, digest, "event already aggregated"); }
    public static MergeResult rejected(String message) { return new MergeResult(Status.REJECTED, null, message); }
    public static MergeResult storeUnavailable(String message) { return new MergeResult(Status.STORE_UNAVAILABLE, null, message); }

    /** True when the alert is reflected in the digest (newly or from an earlier delivery). */
    public boolean isAggregated() {
        return status != Status.STORE_UNAVAILABLE && status != Status.REJECTED;
    }

    /** Only a store outage is worth redelivering; a rejected alert fails the same way every time. */
    public boolean isRetryable() {
        return status == Status.STORE_UNAVAILABLE;
    }
}
