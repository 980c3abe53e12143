package uk.gegc.aimeter.features.billing.infra.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface ChargeReceiptRepository extends JpaRepository<ChargeReceipt, UUID> {

    boolean existsBySourceSystemAndSourceReference(SourceSystem sourceSystem, String sourceReference);

    /**
     * Reconciliation lookup, served by the {@code (run_id, attempt)} index.
     */
    List<ChargeReceipt> findByRunIdAndAttemptOrderByCreatedAtAsc(String runId, int attempt);

    /**
     * Every receipt of an account in {@code [from, to)}, oldest first. Served by the
     * {@code (billing_account_id, created_at)} index.
     */
    List<ChargeReceipt> findByBillingAccountIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
            String billingAccountId, LocalDateTime from, LocalDateTime to);

    /**
     * Newest-first keyset page. A null {@code afterCreatedAt} starts at the newest receipt;
     * otherwise the page continues strictly after {@code (afterCreatedAt, afterId)}.
     */
    @Query("""
            select r from ChargeReceipt r
            where r.billingAccountId = :billingAccountId
              and r.createdAt >= :from
              and r.createdAt < :to
              and (:afterCreatedAt is null
                   or r.createdAt < :afterCreatedAt
                   or (r.createdAt = :afterCreatedAt and r.id < :afterId))
            order by r.createdAt desc, r.id desc
            """)
    List<ChargeReceipt> findActivityPage(@Param("billingAccountId") String billingAccountId,
                                         @Param("from") LocalDateTime from,
                                         @Param("to") LocalDateTime to,
                                         @Param("afterCreatedAt") LocalDateTime afterCreatedAt,
                                         @Param("afterId") UUID afterId,
                                         Pageable pageable);
}
