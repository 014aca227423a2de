package com.sandy.aiot.alert.digest.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One raw alert folded into a digest. Not addressable on its own.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestAlertItem {

    public static final int EVENT_ID_LENGTH = 128;
    public static final int SUMMARY_LENGTH = 500;
    public static final int DEVICE_NAME_LENGTH = 200;
    public static final int PARAMETER_LENGTH = 32;

    /** Id of the originating raw alert event, used for dedup on redelivery. */
    @Column(name = "event_id", length = EVENT_ID_LENGTH, nullable = false)
    private String eventId;

    /** e.g. "Critical: pH 9.20 at Building A" */
    @Column(length = SUMMARY_LENGTH)
    private String summary;

    @Column(name = "alert_timestamp", nullable = false)
    private Instant timestamp;

    @Column(name = "reading_value")
    private Double value;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AlertSeverity severity;

    @Column(length = DEVICE_NAME_LENGTH)
    private String deviceName;

    @Column(length = PARAMETER_LENGTH)
    private String parameter;
}
