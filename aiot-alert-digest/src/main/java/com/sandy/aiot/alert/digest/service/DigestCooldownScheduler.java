package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.vo.DigestSweepReport;
import com.sandy.aiot.alert.digest.vo.SendOutcome;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Periodically sweeps digests whose cooldown has elapsed and hands them to the send coordinator.
 * Sending is decoupled from aggregation: a burst of alerts yields at most one email per cooldown.
 */
@Service
@Slf4j
public class DigestCooldownScheduler {

    private final DigestStore digestStore;
    private final DigestSendCoordinator sendCoordinator;
    private final Clock clock;
    private final ReentrantLock sweepLock = new ReentrantLock();

    @Value("${digest.enabled:true}")
    private boolean enabled;
    @Value("${digest.scheduler.batch-size:50}")
    private int batchSize;

    public DigestCooldownScheduler(DigestStore digestStore, DigestSendCoordinator sendCoordinator, Clock clock) {
        this.digestStore = digestStore;
        this.sendCoordinator = sendCoordinator;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Digest cooldown scheduler initialized: enabled={} batchSize={}", enabled, batchSize);
    }

    @Scheduled(fixedDelayString = "${digest.scheduler.interval-ms:300000}",
            initialDelayString = "${digest.scheduler.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (!enabled) return;
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("Scheduled digest sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One pass over everything eligible now. Overlapping calls on this node are skipped.
     */
    public DigestSweepReport sweepOnce() {
        DigestSweepReport report = new DigestSweepReport();
        if (!sweepLock.tryLock()) {
            log.info("Digest sweep already running, skipping");
            return report;
        }
        long start = System.currentTimeMillis();
        try {
            Instant now = clock.instant();
            Set<String> seen = new HashSet<>();
            try (Stream<AlertDigest> eligible = selectEligibleDigests(now)) {
                eligible.filter(d -> seen.add(d.getId()))
                        .forEach(d -> {
                            SendOutcome outcome = sendCoordinator.attemptSend(d);
                            report.record(outcome);
                        });
            } catch (DigestStoreUnavailableException e) {
                log.error("Failed to query eligible digests: {}", e.getMessage());
            }
        } finally {
            sweepLock.unlock();
        }
        report.setDurationMs(System.currentTimeMillis() - start);
        if (report.getSelected() == 0) {
            log.info("No eligible digests to send at this time");
        } else {
            log.info("Digest send cycle completed: selected={} sent={} failed={} skipped={} durationMs={}",
                    report.getSelected(), report.getSent(), report.getFailed(), report.getSkipped(), report.getDurationMs());
        }
        return report;
    }

    /**
     * Lazy scan of send-eligible digests, fetched a page at a time by ascending id.
     */
    public Stream<AlertDigest> selectEligibleDigests(Instant now) {
        return selectEligibleDigests(now, "");
    }

    /**
     * Restarts the scan after {@code afterId}. Each digest is yielded at most once per stream,
     * even if it is still eligible after being processed.
     */
    public Stream<AlertDigest> selectEligibleDigests(Instant now, String afterId) {
        Iterator<AlertDigest> it = new EligiblePageIterator(now, afterId);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private class EligiblePageIterator implements Iterator<AlertDigest> {
        private final Instant now;
        private final Deque<AlertDigest> page = new ArrayDeque<>();
        private String cursor;
        private boolean exhausted;

        EligiblePageIterator(Instant now, String afterId) {
            this.now = now;
            this.cursor = afterId == null ? "" : afterId;
        }

        @Override
        public boolean hasNext() {
            if (page.isEmpty() && !exhausted) {
                int limit = Math.max(1, batchSize);
                List<AlertDigest> next = digestStore.findEligiblePage(now, cursor, limit);
                page.addAll(next);
                if (!next.isEmpty()) {
                    cursor = next.get(next.size() - 1).getId();
                }
                exhausted = next.size() < limit;
            }
            return !page.isEmpty();
        }

        @Override
        public AlertDigest next() {
            if (!hasNext()) throw new NoSuchElementException();
            return page.removeFirst();
        }
    }
}
