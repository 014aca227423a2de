package com.sandy.aiot.alert.digest.service.impl;

import com.sandy.aiot.alert.digest.MutableClock;
import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.AlertSeverity;
import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.exception.DigestWriteRejectedException;
import com.sandy.aiot.alert.digest.repository.AlertDigestRepository;
import com.sandy.aiot.alert.digest.service.DigestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class JpaDigestStoreTest {

    static final String ID = "u1_turbidity_high_2024-05-01";

    @Autowired DigestStore digestStore;
    @Autowired AlertDigestRepository repository;
    @Autowired PlatformTransactionManager transactionManager;
    @Autowired MutableClock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock.set(Instant.parse("2024-05-01T00:00:00Z"));
    }

    private AlertDigest newDigest(String email) {
        Instant now = clock.instant();
        return AlertDigest.builder()
                .id(ID)
                .recipientUid("u1")
                .recipientEmail(email)
                .category("turbidity_high")
                .createdAt(now)
                .lastUpdatedAt(now)
                .cooldownUntil(now)
                .ackToken("a".repeat(64))
                .build();
    }

    private static DigestAlertItem item(String eventId, String deviceName) {
        return DigestAlertItem.builder()
                .eventId(eventId)
                .summary("Warning: Turbidity 7.10 NTU")
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .value(7.1)
                .severity(AlertSeverity.Warning)
                .deviceName(deviceName)
                .parameter("turbidity")
                .build();
    }

    @Test
    void insertByAnotherWriterBetweenLookupAndInsertIsRetriedAndMerged() {
        TransactionTemplate otherWriter = new TransactionTemplate(transactionManager);
        otherWriter.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        AtomicInteger factoryCalls = new AtomicInteger();
        List<Boolean> createdFlags = new CopyOnWriteArrayList<>();

        Integer size = digestStore.upsert(ID,
                () -> {
                    factoryCalls.incrementAndGet();
                    // another node creates the same digest after our lookup found nothing
                    otherWriter.executeWithoutResult(status -> {
                        AlertDigest theirs = newDigest("other-node@example.org");
                        theirs.appendItem(item("from-other-node", "Tank-9"));
                        repository.saveAndFlush(theirs);
                    });
                    return newDigest("u1@example.org");
                },
                (digest, created) -> {
                    createdFlags.add(created);
                    digest.appendItem(item("local", "Tank-1"));
                    return digest.getItems().size();
                });

        assertEquals(2, size);
        assertEquals(1, factoryCalls.get());
        assertEquals(List.of(true, false), createdFlags);
        AlertDigest stored = repository.findById(ID).orElseThrow();
        assertEquals(List.of("from-other-node", "local"),
                stored.getItems().stream().map(DigestAlertItem::getEventId).collect(Collectors.toList()));
        assertEquals("other-node@example.org", stored.getRecipientEmail());
    }

    @Test
    void integrityViolationOtherThanDuplicateKeyIsRejectedWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DigestWriteRejectedException.class, () -> digestStore.upsert(ID,
                () -> newDigest("u1@example.org"),
                (digest, created) -> {
                    attempts.incrementAndGet();
                    digest.appendItem(item("e1", "x".repeat(DigestAlertItem.DEVICE_NAME_LENGTH + 80)));
                    return null;
                }));

        assertEquals(1, attempts.get());
        assertTrue(repository.findById(ID).isEmpty());
    }

    @Test
    void uniqueViolationIsRecognisedThroughTheCauseChain() {
        SQLException duplicate = new SQLException("Unique index or primary key violation", "23505");
        SQLException tooLong = new SQLException("Value too long for column", "22001");

        assertTrue(JpaDigestStore.isUniqueViolation(new DataIntegrityViolationException("insert", duplicate)));
        assertFalse(JpaDigestStore.isUniqueViolation(new DataIntegrityViolationException("insert", tooLong)));
        assertFalse(JpaDigestStore.isUniqueViolation(new DataIntegrityViolationException("insert")));
    }
}
