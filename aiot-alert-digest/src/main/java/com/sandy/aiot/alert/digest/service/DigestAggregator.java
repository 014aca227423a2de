package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.exception.DigestWriteRejectedException;
import com.sandy.aiot.alert.digest.tools.AckTokens;
import com.sandy.aiot.alert.digest.tools.DigestKeys;
import com.sandy.aiot.alert.digest.vo.MergeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Folds alert items into the digest addressed by (recipient, category, day).
 * Never sends; the cooldown scheduler picks digests up later.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DigestAggregator {

    private final DigestStore digestStore;
    private final Clock clock;

    /**
     * Read-or-create the digest and append {@code item} (oldest evicted past the cap).
     * Redelivered events (same eventId) are not appended twice.
     * {@code recipientEmail} is only used when the digest is created.
     */
    public MergeResult mergeAlert(String recipientUid, String recipientEmail, String category, LocalDate day, DigestAlertItem item) {
        String digestId = DigestKeys.digestId(recipientUid, category, day);
        try {
            return digestStore.upsert(digestId,
                    () -> newDigest(digestId, recipientUid, recipientEmail, category),
                    (digest, created) -> {
                        if (!created && digest.containsEvent(item.getEventId())) {
                            log.debug("Event {} already in digest {}, skipping duplicate", item.getEventId(), digestId);
                            return MergeResult.duplicate(digest);
                        }
                        int before = digest.getItems().size();
                        digest.appendItem(item);
                        digest.setLastUpdatedAt(clock.instant());
                        if (created) {
                            log.info("Created digest {} for {} category={}", digestId, recipientEmail, category);
                            return MergeResult.created(digest);
                        }
                        if (before == digest.getItems().size()) {
                            log.info("Digest {} at capacity, evicted oldest item", digestId);
                        }
                        log.debug("Merged event {} into digest {} items={}", item.getEventId(), digestId, digest.getItems().size());
                        return MergeResult.merged(digest);
                    });
        } catch (DigestWriteRejectedException e) {
            log.error("Event {} rejected by digest store for {}: {}", item.getEventId(), digestId, e.getCause().getMessage());
            return MergeResult.rejected(e.getMessage());
        } catch (DigestStoreUnavailableException e) {
            log.error("Failed to merge event {} into digest {}: {}", item.getEventId(), digestId, e.getMessage());
            return MergeResult.storeUnavailable(e.getMessage());
        }
    }

    private AlertDigest newDigest(String digestId, String recipientUid, String recipientEmail, String category) {
        Instant now = clock.instant();
        return AlertDigest.builder()
                .id(digestId)
                .recipientUid(recipientUid)
                .recipientEmail(recipientEmail)
                .category(category)
                .createdAt(now)
                .lastUpdatedAt(now)
                .cooldownUntil(now)
                .sendAttempts(0)
                .acknowledged(false)
                .ackToken(AckTokens.generate())
                .build();
    }
}
