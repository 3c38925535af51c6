package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Prepaid ticket credit balance of an organizer.
 */
@Entity
@Table(name = "organizer_credits")
@Getter
@Setter
public class OrganizerCredits {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organizer_id", nullable = false, unique = true, length = 64)
    private String organizerId;

    @Column(name = "credits_total", nullable = false)
    private int creditsTotal;

    @Column(name = "credits_used", nullable = false)
    private int creditsUsed;

    @Column(name = "credits_remaining", nullable = false)
    private int creditsRemaining;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void addCredits(int quantity, LocalDateTime at) {
        creditsTotal += quantity;
        creditsRemaining += quantity;
        updatedAt = at;
    }
}
