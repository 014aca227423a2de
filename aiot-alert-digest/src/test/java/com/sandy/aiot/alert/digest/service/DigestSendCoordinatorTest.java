package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.MutableClock;
import com.sandy.aiot.alert.digest.RecordingDigestEmailTransport;
import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.repository.AlertDigestRepository;
import com.sandy.aiot.alert.digest.vo.DigestEmail;
import com.sandy.aiot.alert.digest.vo.SendOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class DigestSendCoordinatorTest {

    static final LocalDate DAY = LocalDate.of(2024, 5, 1);
    static final String ID = "u1_ph_high_2024-05-01";

    @Autowired DigestSendCoordinator coordinator;
    @Autowired DigestAggregator aggregator;
    @Autowired DigestStore digestStore;
    @Autowired AlertDigestRepository repository;
    @Autowired RecordingDigestEmailTransport transport;
    @Autowired MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        transport.reset();
        clock.set(Instant.parse("2024-05-01T00:00:00Z"));
    }

    private AlertDigest digestWith(String... eventIds) {
        for (String e : eventIds) {
            aggregator.mergeAlert("u1", "u1@example.org", "ph_high", DAY, DigestAggregatorTest.item(e));
        }
        return repository.findById(ID).orElseThrow();
    }

    @Test
    void successfulSendStartsTwentyFourHourCooldown() {
        AlertDigest d = digestWith("e1", "e2", "e3");
        clock.advance(Duration.ofMinutes(5));

        SendOutcome outcome = coordinator.attemptSend(d);

        assertEquals(SendOutcome.Status.SENT, outcome.getStatus());
        AlertDigest after = repository.findById(ID).orElseThrow();
        assertEquals(clock.instant(), after.getLastSentAt());
        assertEquals(after.getLastSentAt().plus(Duration.ofHours(24)), after.getCooldownUntil());
        assertEquals(1, after.getSendAttempts());
        assertNull(after.getSendClaimExpiresAt());

        DigestEmail email = transport.getSent().get(0);
        assertEquals("u1@example.org", email.getRecipientEmail());
        assertEquals("ph_high", email.getCategory());
        assertEquals(List.of("e1", "e2", "e3"), email.getItems().stream().map(DigestAlertItem::getEventId).collect(Collectors.toList()));
        assertEquals(after.getAckToken(), email.getAckToken());
    }

    @Test
    void cooldownAfterSendIsIndependentOfItemCount() {
        AlertDigest empty = digestStore.upsert("u9_ph_high_2024-05-01", () -> AlertDigest.builder()
                .id("u9_ph_high_2024-05-01").recipientUid("u9").recipientEmail("u9@example.org").category("ph_high")
                .createdAt(clock.instant()).lastUpdatedAt(clock.instant()).cooldownUntil(clock.instant())
                .ackToken("t").build(), (d, created) -> d);
        assertTrue(empty.getItems().isEmpty());

        for (int i = 0; i < 7; i++) {
            aggregator.mergeAlert("u9", "u9@example.org", "ph_high", DAY, DigestAggregatorTest.item("n" + i));
        }
        clock.advance(Duration.ofMinutes(1));
        coordinator.attemptSend(repository.findById("u9_ph_high_2024-05-01").orElseThrow());

        AlertDigest after = repository.findById("u9_ph_high_2024-05-01").orElseThrow();
        assertEquals(after.getLastSentAt().plus(Duration.ofHours(24)), after.getCooldownUntil());
    }

    @Test
    void failedSendCountsAttemptButKeepsCooldown() {
        AlertDigest d = digestWith("e1");
        Instant cooldownBefore = d.getCooldownUntil();
        transport.setFailing(true);

        SendOutcome outcome = coordinator.attemptSend(d);

        assertEquals(SendOutcome.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getReason().contains("SMTP unavailable"), outcome.getReason());
        AlertDigest after = repository.findById(ID).orElseThrow();
        assertEquals(1, after.getSendAttempts());
        assertEquals(cooldownBefore, after.getCooldownUntil());
        assertNull(after.getLastSentAt());
        assertTrue(after.isEligibleForSend(clock.instant()), "retryable on the next pass");
    }

    @Test
    void threeFailuresCloseTheDigest() {
        digestWith("e1");
        transport.setFailing(true);

        for (int i = 0; i < 3; i++) {
            assertEquals(SendOutcome.Status.FAILED, coordinator.attemptSend(repository.findById(ID).orElseThrow()).getStatus());
        }
        AlertDigest after = repository.findById(ID).orElseThrow();
        assertEquals(3, after.getSendAttempts());
        assertFalse(after.isEligibleForSend(clock.instant().plus(Duration.ofDays(10))));

        transport.setFailing(false);
        SendOutcome fourth = coordinator.attemptSend(after);
        assertEquals(SendOutcome.Status.SKIPPED, fourth.getStatus());
        assertEquals(3, transport.getCalls());
        assertEquals(3, repository.findById(ID).orElseThrow().getSendAttempts());
    }

    @Test
    void transportTimeoutIsAFailure() {
        AlertDigest d = digestWith("e1");
        transport.setDelayMs(2_000); // test profile timeout is 500ms

        SendOutcome outcome = coordinator.attemptSend(d);

        assertEquals(SendOutcome.Status.FAILED, outcome.getStatus());
        assertTrue(outcome.getReason().contains("timed out"), outcome.getReason());
        AlertDigest after = repository.findById(ID).orElseThrow();
        assertEquals(1, after.getSendAttempts());
        assertNull(after.getSendClaimExpiresAt());
    }

    @Test
    void timedOutSendThreadIsInterrupted() throws InterruptedException {
        AlertDigest d = digestWith("e1");
        transport.setDelayMs(10_000);

        assertEquals(SendOutcome.Status.FAILED, coordinator.attemptSend(d).getStatus());

        long deadline = System.currentTimeMillis() + 2_000;
        while (transport.getInterrupted() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(1, transport.getInterrupted(), "stalled transport thread should be released on timeout");
        assertTrue(transport.getSent().isEmpty());
    }

    @Test
    void staleSnapshotCannotTriggerASecondSendInsideCooldown() {
        AlertDigest stale = digestWith("e1");
        assertEquals(SendOutcome.Status.SENT, coordinator.attemptSend(stale).getStatus());

        SendOutcome again = coordinator.attemptSend(stale);

        assertEquals(SendOutcome.Status.SKIPPED, again.getStatus());
        assertEquals(1, transport.getSent().size());
        assertEquals(1, repository.findById(ID).orElseThrow().getSendAttempts());
    }

    @Test
    void itemsMergedDuringSendWaitForTheNextCycle() {
        AlertDigest d = digestWith("e1", "e2");
        transport.setDuringSend(email ->
                aggregator.mergeAlert("u1", "u1@example.org", "ph_high", DAY, DigestAggregatorTest.item("late")));

        coordinator.attemptSend(d);

        DigestEmail email = transport.getSent().get(0);
        assertEquals(List.of("e1", "e2"), email.getItems().stream().map(DigestAlertItem::getEventId).collect(Collectors.toList()));
        assertEquals(List.of("e1", "e2", "late"), DigestAggregatorTest.eventIds(repository.findById(ID).orElseThrow()));
    }
}
