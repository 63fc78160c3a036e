package dev.leaddispatch.entity;

import dev.leaddispatch.model.GeoPoint;
import dev.leaddispatch.model.LeadStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A prospective customer location collected from the lookup provider.
 * The same physical business (name + coordinates) is stored once.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "leads",
        uniqueConstraints = @UniqueConstraint(name = "uk_leads_identity", columnNames = {"name", "lat", "lon"}),
        indexes = {
                @Index(name = "idx_leads_category", columnList = "category"),
                @Index(name = "idx_leads_status", columnList = "status")
        })
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 500)
    private String name;

    @Column(nullable = false)
    private String category;

    @Column(length = 500)
    private String address;

    @Column(name = "lat")
    private Double latitude;

    @Column(name = "lon")
    private Double longitude;

    @Column(length = 20)
    private String phone;

    @Column(length = 100)
    private String email;

    private String source;

    private String note;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LeadStatus status = LeadStatus.NEW;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime lastContact;

    @Builder.Default
    @Column(nullable = false)
    private int contactCount = 0;

    public Optional<GeoPoint> getLocation() {
        return GeoPoint.of(latitude, longitude);
    }

    public boolean hasPhone() {
        return phone != null && !phone.isBlank();
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    /**
     * Transition used by the matching engine when a job is dispatched.
     */
    public void markContacted(LocalDateTime now) {
        this.status = LeadStatus.CONTACTED;
        this.updatedAt = now;
    }

    /**
     * Transition used by outreach after a message was delivered.
     */
    public void recordContact(LocalDateTime now) {
        this.contactCount++;
        this.lastContact = now;
        markContacted(now);
    }
}
