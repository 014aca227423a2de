package com.sandy.aiot.alert.digest.vo;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Outcome of one send attempt. SKIPPED means no attempt was claimed and nothing was sent.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SendOutcome {
    public enum Status { SENT, FAILED, SKIPPED }

    private final String digestId;
    private final Status status;
    private final String reason;

    public static SendOutcome sent(String digestId) { return new SendOutcome(digestId, Status.SENT, null); }
    public static SendOutcome failed(String digestId, String reason) { return new SendOutcome(digestId, Status.FAILED, reason); }
    public static SendOutcome skipped(String digestId, String reason) { return new SendOutcome(digestId, Status.SKIPPED, reason); }
}
