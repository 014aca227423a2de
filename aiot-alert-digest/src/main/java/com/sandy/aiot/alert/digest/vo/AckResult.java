package com.sandy.aiot.alert.digest.vo;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of an acknowledgment request. ALREADY_ACKNOWLEDGED is a success for callers.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class AckResult {
    public enum Status { ACKNOWLEDGED, ALREADY_ACKNOWLEDGED, NOT_FOUND, INVALID_TOKEN, STORE_UNAVAILABLE }

    private final Status status;
    private final String digestId;

    public static AckResult of(Status status, String digestId) {
        return new AckResult(status, digestId);
    }

    public boolean isSuccess() {
        return status == Status.ACKNOWLEDGED || status == Status.ALREADY_ACKNOWLEDGED;
    }
}
