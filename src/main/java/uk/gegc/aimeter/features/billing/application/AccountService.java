package uk.gegc.aimeter.features.billing.application;

import uk.gegc.aimeter.features.billing.domain.exception.AccountNotFoundException;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.domain.model.ReceiptWriteResult;

import java.util.List;

/**
 * Ledger port: persists charge receipts and serves cached balances.
 */
public interface AccountService {

    /**
     * Cached balance in credits. Non-transactional snapshot, may be stale.
     *
     * @throws AccountNotFoundException when the account is unknown
     */
    long getBalance(String billingAccountId);

    /**
     * Persists a receipt and debits the account. A receipt whose idempotency key already exists
     * is not written again and {@link ReceiptWriteResult#DUPLICATE} is returned.
     */
    ReceiptWriteResult recordChargeReceipt(ChargeReceiptParams params);

    List<ChargeReceipt> findReceiptsForRun(String runId, int attempt);
}
