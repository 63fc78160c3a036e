package dev.leaddispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Memoized lookup response keyed by the query fingerprint.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "api_cache", indexes = {
        @Index(name = "idx_cache_hash", columnList = "query_hash")
})
public class CachedQuery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "query_hash", nullable = false, unique = true)
    private String fingerprint;

    @Column(nullable = false)
    private String queryParams;

    @Column(nullable = false)
    private String responseData;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    /**
     * An entry is live strictly before its expiry instant.
     */
    public boolean isLiveAt(LocalDateTime now) {
        return expiresAt.isAfter(now);
    }
}
