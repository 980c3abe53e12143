package uk.gegc.aimeter.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.aimeter.features.billing.domain.model.BillingAccount;

public interface BillingAccountRepository extends JpaRepository<BillingAccount, String> {

    /**
     * Atomic in-place debit. Balances are allowed to go negative.
     *
     * @return number of updated rows, {@code 0} when the account does not exist
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update BillingAccount a set a.balanceCredits = a.balanceCredits - :credits where a.id = :accountId")
    int debit(@Param("accountId") String accountId, @Param("credits") long credits);
}
