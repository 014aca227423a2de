package com.sandy.aiot.alert.digest.repository;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertDigestRepository extends JpaRepository<AlertDigest, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from AlertDigest d where d.id = :id")
    Optional<AlertDigest> findForUpdate(@Param("id") String id);

    /**
     * Keyset page of send-eligible digests with ids after {@code afterId}, ordered by id.
     */
    @Query("select d from AlertDigest d " +
            "where d.acknowledged = false " +
            "and d.sendAttempts < :maxAttempts " +
            "and d.cooldownUntil <= :now " +
            "and (d.sendClaimExpiresAt is null or d.sendClaimExpiresAt <= :now) " +
            "and d.items is not empty " +
            "and d.id > :afterId " +
            "order by d.id asc")
    List<AlertDigest> findEligiblePage(@Param("now") Instant now,
                                       @Param("maxAttempts") int maxAttempts,
                                       @Param("afterId") String afterId,
                                       Pageable page);

    List<AlertDigest> findByRecipientUidOrderByLastUpdatedAtDesc(String recipientUid);

    List<AlertDigest> findTop50ByOrderByLastUpdatedAtDesc();
}
