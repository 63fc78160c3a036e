package dev.leaddispatch.repository;

import dev.leaddispatch.entity.Lead;
import dev.leaddispatch.model.LeadStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for collected leads.
 */
@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    interface StatusCount {
        LeadStatus getStatus();

        Long getTotal();
    }

    /**
     * Check the (name, lat, lon) identity. Null coordinates compare as IS NULL.
     */
    boolean existsByNameAndLatitudeAndLongitude(String name, Double latitude, Double longitude);

    /**
     * Leads waiting for dispatch whose category contains the service keyword,
     * in insertion order.
     */
    List<Lead> findByStatusAndCategoryContainingIgnoreCaseOrderByIdAsc(
            LeadStatus status, String category, Pageable pageable);

    List<Lead> findAllByOrderByIdDesc(Pageable pageable);

    List<Lead> findAllByOrderByIdAsc();

    long countByStatus(LeadStatus status);

    @Query("SELECT COUNT(DISTINCT l.category) FROM Lead l")
    long countCategories();

    @Query("SELECT l.status AS status, COUNT(l) AS total FROM Lead l GROUP BY l.status")
    List<StatusCount> countByStatusGrouped();

    /**
     * Delete leads with no usable location and no contact details.
     * Leads that jobs or messages point at are kept.
     */
    @Modifying
    @Query(value = """
            DELETE FROM leads
            WHERE (lat IS NULL OR lon IS NULL OR (lat = 0 AND lon = 0))
              AND COALESCE(phone, '') = ''
              AND COALESCE(email, '') = ''
              AND id NOT IN (SELECT lead_id FROM jobs)
              AND id NOT IN (SELECT lead_id FROM messages)
            """, nativeQuery = true)
    int deleteDegenerate();

    /**
     * Delete exact (name, lat, lon) duplicates, keeping the oldest row.
     */
    @Modifying
    @Query(value = """
            DELETE FROM leads
            WHERE id NOT IN (SELECT MIN(id) FROM leads GROUP BY name, lat, lon)
              AND id NOT IN (SELECT lead_id FROM jobs)
              AND id NOT IN (SELECT lead_id FROM messages)
            """, nativeQuery = true)
    int deleteDuplicates();
}
