package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.tools.AckTokens;
import com.sandy.aiot.alert.digest.vo.AckResult;
import com.sandy.aiot.alert.digest.vo.AckResult.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Terminal acknowledgment of a digest through its emailed token.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DigestAcknowledgmentService {

    private final DigestStore digestStore;
    private final Clock clock;

    public AckResult acknowledge(String digestId, String token, String actorUid) {
        return acknowledge(digestId, token, actorUid, clock.instant());
    }

    /**
     * Wrong tokens and repeated acknowledgments leave the digest untouched.
     * The first success stamps who/when and resets the attempt counter.
     * A null or blank {@code actorUid} records the digest's recipient as the actor.
     */
    public AckResult acknowledge(String digestId, String token, String actorUid, Instant now) {
        AtomicReference<String> acknowledgedBy = new AtomicReference<>();
        Optional<Status> status;
        try {
            status = digestStore.mutate(digestId, d -> {
                if (!AckTokens.matches(d.getAckToken(), token)) return Status.INVALID_TOKEN;
                if (d.isAcknowledged()) return Status.ALREADY_ACKNOWLEDGED;
                d.setAcknowledged(true);
                d.setAcknowledgedBy(actorUid != null && !actorUid.isBlank()
                        ? clip(actorUid, AlertDigest.ACTOR_LENGTH) : d.getRecipientUid());
                acknowledgedBy.set(d.getAcknowledgedBy());
                d.setAcknowledgedAt(now);
                d.setSendAttempts(0);
                return Status.ACKNOWLEDGED;
            });
        } catch (DigestStoreUnavailableException e) {
            log.error("Acknowledgment of digest {} failed: {}", digestId, e.getMessage());
            return AckResult.of(Status.STORE_UNAVAILABLE, digestId);
        }
        AckResult result = AckResult.of(status.orElse(Status.NOT_FOUND), digestId);
        switch (result.getStatus()) {
            case ACKNOWLEDGED -> log.info("Digest {} acknowledged by {}", digestId, acknowledgedBy.get());
            case ALREADY_ACKNOWLEDGED -> log.info("Digest {} was already acknowledged", digestId);
            case INVALID_TOKEN -> log.warn("Invalid ack token for digest {}", digestId);
            case NOT_FOUND -> log.warn("Ack requested for unknown digest {}", digestId);
            default -> { }
        }
        return result;
    }

    private static String clip(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
