package dev.leaddispatch.repository;

import dev.leaddispatch.entity.CachedQuery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repository for memoized lookup responses.
 */
@Repository
public interface CachedQueryRepository extends JpaRepository<CachedQuery, Long> {

    Optional<CachedQuery> findByFingerprint(String fingerprint);

    /**
     * Maintenance sweep: drop entries written before the cutoff.
     */
    @Modifying
    @Query("DELETE FROM CachedQuery c WHERE c.createdAt < :cutoff")
    int deleteCreatedBefore(LocalDateTime cutoff);
}
