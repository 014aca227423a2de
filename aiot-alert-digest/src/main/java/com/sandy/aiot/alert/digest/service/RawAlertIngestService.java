package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.tools.AlertSummaryFormatter;
import com.sandy.aiot.alert.digest.tools.DigestKeys;
import com.sandy.aiot.alert.digest.vo.MergeResult;
import com.sandy.aiot.alert.digest.vo.RawAlertEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Entry point for raw alert events: categorize, build the digest item, merge.
 * The digest day is the UTC day the event is aggregated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RawAlertIngestService {

    private final DigestCategorizer categorizer;
    private final DigestAggregator aggregator;
    private final Clock clock;

    /**
     * Display fields (device name, parameter, summary) are cut to their column sizes.
     *
     * @throws IllegalArgumentException when a required field is missing or an identifying field is too long
     */
    public MergeResult ingest(RawAlertEvent event) {
        validate(event);
        String category = categorizer.categorize(event.getParameter(), event.getValue());
        Instant now = clock.instant();
        DigestAlertItem item = DigestAlertItem.builder()
                .eventId(event.getEventId())
                .summary(clip(AlertSummaryFormatter.summarize(event), DigestAlertItem.SUMMARY_LENGTH))
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : now)
                .value(event.getValue())
                .severity(event.getSeverity())
                .deviceName(clip(event.getDeviceName(), DigestAlertItem.DEVICE_NAME_LENGTH))
                .parameter(clip(event.getParameter(), DigestAlertItem.PARAMETER_LENGTH))
                .build();
        MergeResult result = aggregator.mergeAlert(event.getRecipientUid(), event.getRecipientEmailAtCreation(),
                category, DigestKeys.utcDay(now), item);
        log.debug("Ingested event {} recipient={} category={} status={}", event.getEventId(), event.getRecipientUid(), category, result.getStatus());
        return result;
    }

    private void validate(RawAlertEvent event) {
        if (event == null) throw new IllegalArgumentException("event is required");
        if (isBlank(event.getEventId())) throw new IllegalArgumentException("eventId is required");
        if (isBlank(event.getRecipientUid())) throw new IllegalArgumentException("recipientUid is required");
        if (isBlank(event.getRecipientEmailAtCreation())) throw new IllegalArgumentException("recipientEmailAtCreation is required");
        if (event.getSeverity() == null) throw new IllegalArgumentException("severity is required");
        checkLength("eventId", event.getEventId(), DigestAlertItem.EVENT_ID_LENGTH);
        checkLength("recipientUid", event.getRecipientUid(), AlertDigest.RECIPIENT_UID_LENGTH);
        checkLength("recipientEmailAtCreation", event.getRecipientEmailAtCreation(), AlertDigest.RECIPIENT_EMAIL_LENGTH);
    }

    // identifying fields are rejected, never cut
    private static void checkLength(String field, String value, int max) {
        if (value.length() > max) {
            throw new IllegalArgumentException(field + " exceeds " + max + " characters");
        }
    }

    static String clip(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
