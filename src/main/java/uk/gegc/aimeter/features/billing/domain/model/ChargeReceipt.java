package uk.gegc.aimeter.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One billed (possibly zero-credit) unit of usage. Written once, never updated.
 */
@Entity
@Table(
        name = "charge_receipts",
        uniqueConstraints = @UniqueConstraint(
                name = "charge_receipts_source_idempotency_unique",
                columnNames = {"source_system", "source_reference"}),
        indexes = {
                @Index(name = "charge_receipts_run_attempt_idx", columnList = "run_id, attempt"),
                @Index(name = "charge_receipts_ingress_request_idx", columnList = "ingress_request_id"),
                @Index(name = "charge_receipts_account_created_idx", columnList = "billing_account_id, created_at")
        })
@Getter
@Setter
public class ChargeReceipt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "billing_account_id", nullable = false, updatable = false, length = 64)
    private String billingAccountId;

    @Column(name = "virtual_key_id", nullable = false, updatable = false, length = 64)
    private String virtualKeyId;

    @Column(name = "run_id", nullable = false, updatable = false, length = 64)
    private String runId;

    @Column(name = "attempt", nullable = false, updatable = false)
    private int attempt;

    @Column(name = "ingress_request_id", updatable = false, length = 64)
    private String ingressRequestId;

    @Column(name = "charged_credits", nullable = false, updatable = false)
    private long chargedCredits;

    @Column(name = "response_cost_usd", updatable = false, precision = 20, scale = 10)
    private BigDecimal responseCostUsd;

    @Column(name = "litellm_call_id", updatable = false, length = 128)
    private String litellmCallId;

    @Convert(converter = ChargeProvenanceConverter.class)
    @Column(name = "provenance", nullable = false, updatable = false, length = 16)
    private ChargeProvenance provenance;

    @Convert(converter = ChargeReasonConverter.class)
    @Column(name = "charge_reason", nullable = false, updatable = false, length = 32)
    private ChargeReason chargeReason;

    @Convert(converter = SourceSystemConverter.class)
    @Column(name = "source_system", nullable = false, updatable = false, length = 32)
    private SourceSystem sourceSystem;

    @Column(name = "source_reference", nullable = false, updatable = false, length = 255)
    private String sourceReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
