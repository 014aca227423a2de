package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.exception.DigestStoreUnavailableException;
import com.sandy.aiot.alert.digest.exception.DigestWriteRejectedException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Durable keyed record of digests. All writes go through {@link #upsert} or {@link #mutate};
 * each call is one atomic, per-key serialised unit of work.
 * Every method throws {@link DigestStoreUnavailableException} when the store cannot complete it.
 * Writes throw {@link DigestWriteRejectedException} when the row itself is unacceptable; those are not retried.
 */
public interface DigestStore {

    /**
     * Loads the digest for {@code digestId} (creating it with {@code factory} when absent) and applies
     * {@code mutation}; the boolean argument tells the mutation whether the digest was just created.
     */
    <R> R upsert(String digestId, Supplier<AlertDigest> factory, BiFunction<AlertDigest, Boolean, R> mutation);

    /**
     * Applies {@code mutation} to an existing digest. Empty when no digest has that id.
     * A null return from the mutation is also reported as empty.
     */
    <R> Optional<R> mutate(String digestId, Function<AlertDigest, R> mutation);

    Optional<AlertDigest> findById(String digestId);

    /** Up to {@code limit} send-eligible digests with id greater than {@code afterId}, ordered by id. */
    List<AlertDigest> findEligiblePage(Instant now, String afterId, int limit);

    List<AlertDigest> findByRecipient(String recipientUid);

    List<AlertDigest> findRecent();
}
