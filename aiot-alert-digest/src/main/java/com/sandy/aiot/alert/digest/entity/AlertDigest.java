package com.sandy.aiot.alert.digest.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated notification state for one recipient, category and UTC day.
 * Id format: {recipientUid}_{category}_{YYYY-MM-DD}.
 * Mutated only through {@link com.sandy.aiot.alert.digest.service.DigestStore}.
 */
@Entity
@Table(name = "alert_digests", indexes = {
        @Index(name = "idx_digest_eligible", columnList = "acknowledged,send_attempts,cooldown_until"),
        @Index(name = "idx_digest_recipient", columnList = "recipient_uid")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "ackToken")
public class AlertDigest {

    public static final int RECIPIENT_UID_LENGTH = 128;
    public static final int RECIPIENT_EMAIL_LENGTH = 320;
    public static final int ACTOR_LENGTH = 128;

    @Id
    @Column(length = 255)
    private String id;

    @Column(name = "recipient_uid", length = RECIPIENT_UID_LENGTH, nullable = false)
    private String recipientUid;

    /** Cached at creation; never re-resolved for the life of the digest. */
    @Column(name = "recipient_email", length = RECIPIENT_EMAIL_LENGTH, nullable = false)
    private String recipientEmail;

    @Column(length = 32, nullable = false)
    private String category;

    /** Oldest first, capped at {@link DigestPolicy#MAX_ITEMS}. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "alert_digest_items", joinColumns = @JoinColumn(name = "digest_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<DigestAlertItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    @Column(name = "last_sent_at")
    private Instant lastSentAt;

    @Column(name = "cooldown_until", nullable = false)
    private Instant cooldownUntil;

    @Column(name = "send_attempts", nullable = false)
    private int sendAttempts;

    /** Lease of an in-flight send claim, null when no send is running. */
    @Column(name = "send_claim_expires_at")
    private Instant sendClaimExpiresAt;

    @Column(nullable = false)
    private boolean acknowledged;

    @Column(name = "acknowledged_by", length = ACTOR_LENGTH)
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "ack_token", length = 64, nullable = false, updatable = false)
    private String ackToken;

    @Version
    private Long version;

    /**
     * Appends in arrival order, evicting from the front once over the cap.
     */
    public void appendItem(DigestAlertItem item) {
        items.add(item);
        while (items.size() > DigestPolicy.MAX_ITEMS) {
            items.remove(0);
        }
    }

    public boolean containsEvent(String eventId) {
        return eventId != null && items.stream().anyMatch(i -> eventId.equals(i.getEventId()));
    }

    /**
     * Send eligibility at {@code now}: not acknowledged, has items, attempts left,
     * cooldown elapsed and no live send claim.
     */
    public boolean isEligibleForSend(Instant now) {
        return !acknowledged
                && !items.isEmpty()
                && sendAttempts < DigestPolicy.MAX_SEND_ATTEMPTS
                && !cooldownUntil.isAfter(now)
                && (sendClaimExpiresAt == null || !sendClaimExpiresAt.isAfter(now));
    }
}
