package com.sandy.aiot.alert.digest.service.impl;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestPolicy;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.exception.DigestWriteRejectedException;
import com.sandy.aiot.alert.digest.repository.AlertDigestRepository;
import com.sandy.aiot.alert.digest.service.DigestStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JPA backed digest store.
 * Same-key calls are serialised in-process by a striped lock; across nodes the row lock
 * (select ... for update) and the version column serialise them, and conflicts
 * (version mismatch, concurrent insert of the same id) are retried a bounded number of times.
 * Other integrity violations are not retried and surface as {@link DigestWriteRejectedException}.
 */
@Service
@Slf4j
public class JpaDigestStore implements DigestStore {

    private static final int LOCK_STRIPES = 64;
    /** SQLSTATE for a unique or primary key violation. */
    private static final String UNIQUE_VIOLATION = "23505";

    private final AlertDigestRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate conflictRetry;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public JpaDigestStore(AlertDigestRepository repository,
                          PlatformTransactionManager transactionManager,
                          @Value("${digest.store.conflict-retries:3}") int conflictRetries,
                          @Value("${digest.store.conflict-backoff-ms:50}") long conflictBackoffMs) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.conflictRetry = RetryTemplate.builder()
                .maxAttempts(Math.max(1, conflictRetries))
                .fixedBackoff(Math.max(1, conflictBackoffMs))
                .retryOn(List.of(OptimisticLockingFailureException.class,
                        PessimisticLockingFailureException.class,
                        DuplicateKeyException.class))
                .traversingCauses()
                .build();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public <R> R upsert(String digestId, Supplier<AlertDigest> factory, BiFunction<AlertDigest, Boolean, R> mutation) {
        return atomically(digestId, () -> {
            Optional<AlertDigest> existing = repository.findForUpdate(digestId);
            AlertDigest digest = existing.orElseGet(factory);
            R result = mutation.apply(digest, existing.isEmpty());
            repository.saveAndFlush(digest);
            return result;
        });
    }

    @Override
    public <R> Optional<R> mutate(String digestId, Function<AlertDigest, R> mutation) {
        return atomically(digestId, () -> repository.findForUpdate(digestId).map(mutation));
    }

    @Override
    public Optional<AlertDigest> findById(String digestId) {
        return read(digestId, () -> repository.findById(digestId));
    }

    @Override
    public List<AlertDigest> findEligiblePage(Instant now, String afterId, int limit) {
        return read("eligible-page", () -> repository.findEligiblePage(
                now, DigestPolicy.MAX_SEND_ATTEMPTS, afterId == null ? "" : afterId, PageRequest.of(0, limit)));
    }

    @Override
    public List<AlertDigest> findByRecipient(String recipientUid) {
        return read(recipientUid, () -> repository.findByRecipientUidOrderByLastUpdatedAtDesc(recipientUid));
    }

    @Override
    public List<AlertDigest> findRecent() {
        return read("recent", repository::findTop50ByOrderByLastUpdatedAtDesc);
    }

    private <R> R atomically(String digestId, Supplier<R> work) {
        ReentrantLock lock = stripeFor(digestId);
        lock.lock();
        try {
            return conflictRetry.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.debug("Retrying digest write id={} attempt={} after {}", digestId, ctx.getRetryCount() + 1,
                            ctx.getLastThrowable() == null ? null : ctx.getLastThrowable().getClass().getSimpleName());
                }
                return inTransaction(digestId, work);
            });
        } catch (DigestWriteRejectedException e) {
            log.warn("Digest write rejected id={} error={}", digestId, e.getCause().getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Digest store write failed id={} error={}", digestId, e.getMessage());
            throw new DigestStoreUnavailableException("Digest store write failed for " + digestId, e);
        } finally {
            lock.unlock();
        }
    }

    private <R> R inTransaction(String digestId, Supplier<R> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DuplicateKeyException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                // another node inserted the same id first; the retry finds its row
                throw new DuplicateKeyException(e.getMessage(), e);
            }
            throw new DigestWriteRejectedException("Digest write rejected for " + digestId, e);
        }
    }

    static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private <R> R read(String what, Supplier<R> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Digest store read failed target={} error={}", what, e.getMessage());
            throw new DigestStoreUnavailableException("Digest store read failed for " + what, e);
        }
    }

    private ReentrantLock stripeFor(String digestId) {
        return stripes[Math.floorMod(digestId.hashCode(), LOCK_STRIPES)];
    }
}
