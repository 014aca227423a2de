package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestPolicy;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.vo.DigestEmail;
import com.sandy.aiot.alert.digest.vo.SendOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Sends one digest: claim the attempt, call the transport with a timeout, record the outcome.
 * The claim counts the attempt and takes a lease before the transport is called, so a
 * concurrent sweep cannot send the same digest while this one is in flight.
 */
@Service
@Slf4j
public class DigestSendCoordinator {

    private final DigestStore digestStore;
    private final DigestEmailTransport transport;
    private final ThreadPoolTaskExecutor sendExecutor;
    private final Clock clock;
    private final long sendTimeoutMs;

    public DigestSendCoordinator(DigestStore digestStore,
                                 DigestEmailTransport transport,
                                 @Qualifier("digestSendExecutor") ThreadPoolTaskExecutor sendExecutor,
                                 Clock clock,
                                 @Value("${digest.send.timeout-ms:30000}") long sendTimeoutMs) {
        this.digestStore = digestStore;
        this.transport = transport;
        this.sendExecutor = sendExecutor;
        this.clock = clock;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    public SendOutcome attemptSend(AlertDigest digest) {
        String digestId = digest.getId();
        Optional<DigestEmail> claim;
        try {
            claim = digestStore.mutate(digestId, this::claim);
        } catch (DigestStoreUnavailableException e) {
            log.warn("Could not claim send for digest {}: {}", digestId, e.getMessage());
            return SendOutcome.skipped(digestId, "store unavailable");
        }
        if (claim.isEmpty()) {
            log.debug("Digest {} no longer eligible, send not claimed", digestId);
            return SendOutcome.skipped(digestId, "not eligible");
        }
        DigestEmail email = claim.get();

        String failure = dispatch(email);
        Instant now = clock.instant();
        if (failure == null) {
            recordOutcome(digestId, d -> {
                d.setLastSentAt(now);
                Instant next = now.plus(DigestPolicy.COOLDOWN);
                d.setCooldownUntil(next.isAfter(d.getCooldownUntil()) ? next : d.getCooldownUntil());
                d.setSendClaimExpiresAt(null);
                return d;
            });
            log.info("Digest email sent: {} to {} (attempt {}/{}, items={})", digestId, email.getRecipientEmail(),
                    email.getAttempt(), DigestPolicy.MAX_SEND_ATTEMPTS, email.getItems().size());
            return SendOutcome.sent(digestId);
        }
        recordOutcome(digestId, d -> {
            d.setSendClaimExpiresAt(null);
            return d;
        });
        log.warn("Digest email failed: {} to {} (attempt {}/{}) reason={}", digestId, email.getRecipientEmail(),
                email.getAttempt(), DigestPolicy.MAX_SEND_ATTEMPTS, failure);
        return SendOutcome.failed(digestId, failure);
    }

    /** Runs inside the store's per-key transaction. Null means the digest is not eligible. */
    private DigestEmail claim(AlertDigest d) {
        Instant now = clock.instant();
        if (!d.isEligibleForSend(now)) return null;
        d.setSendAttempts(d.getSendAttempts() + 1);
        d.setSendClaimExpiresAt(now.plus(claimLease()));
        return DigestEmail.builder()
                .digestId(d.getId())
                .recipientEmail(d.getRecipientEmail())
                .category(d.getCategory())
                .items(new ArrayList<>(d.getItems()))
                .createdAt(d.getCreatedAt())
                .attempt(d.getSendAttempts())
                .ackToken(d.getAckToken())
                .build();
    }

    /**
     * Null on success, otherwise the failure reason.
     * A timed-out send is cancelled with an interrupt. Blocking SMTP socket I/O ignores interrupts,
     * so the {@code spring.mail.properties.mail.smtp.*timeout} settings, kept below
     * {@code digest.send.timeout-ms}, bound how long a stalled thread lingers.
     */
    private String dispatch(DigestEmail email) {
        Future<Void> future = null;
        try {
            future = sendExecutor.submit(() -> {
                transport.send(email);
                return null;
            });
            future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            return "timed out after " + sendTimeoutMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return cause == null ? "transport failure" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) future.cancel(true);
            return "interrupted";
        } catch (TaskRejectedException e) {
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        }
    }

    private void recordOutcome(String digestId, Function<AlertDigest, AlertDigest> update) {
        try {
            digestStore.mutate(digestId, update);
        } catch (DigestStoreUnavailableException e) {
            // lease expiry makes the digest eligible again; attempts stay counted
            log.error("Could not record send outcome for digest {}: {}", digestId, e.getMessage());
        }
    }

    private Duration claimLease() {
        return Duration.ofMillis(sendTimeoutMs * 2);
    }
}
