package uk.gegc.aimeter.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Cached credit balance of a billing account. Debited by every newly recorded receipt;
 * may go negative when usage outruns the advisory admission check.
 */
@Entity
@Table(name = "billing_accounts")
@Getter
@Setter
public class BillingAccount {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "balance_credits", nullable = false)
    private long balanceCredits;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
