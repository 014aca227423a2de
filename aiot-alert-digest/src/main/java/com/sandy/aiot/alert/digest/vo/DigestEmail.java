package com.sandy.aiot.alert.digest.vo;

import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a digest taken when a send attempt is claimed.
 */
@Value
@Builder
public class DigestEmail {
    String digestId;
    String recipientEmail;
    String category;
    List<DigestAlertItem> items;
    Instant createdAt;
    int attempt;
    String ackToken;
}
