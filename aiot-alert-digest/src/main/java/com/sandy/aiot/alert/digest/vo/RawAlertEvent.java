package com.sandy.aiot.alert.digest.vo;

import com.sandy.aiot.alert.digest.entity.AlertSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One raw alert as emitted by the threshold evaluator, already addressed to a single recipient.
 * Severity and threshold crossing are trusted as decided upstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawAlertEvent {
    private String eventId;
    private String parameter;
    private Double value;
    private AlertSeverity severity;
    private String deviceName;
    private Instant timestamp;
    private String recipientUid;
    private String recipientEmailAtCreation;
}
