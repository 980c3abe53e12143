package uk.gegc.aimeter.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.DigestUtils;
import uk.gegc.aimeter.features.billing.application.AccountService;
import uk.gegc.aimeter.features.billing.application.ChargeReceiptParams;
import uk.gegc.aimeter.features.billing.domain.exception.AccountNotFoundException;
import uk.gegc.aimeter.features.billing.domain.model.BillingAccount;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.domain.model.ReceiptWriteResult;
import uk.gegc.aimeter.features.billing.infra.repository.BillingAccountRepository;
import uk.gegc.aimeter.features.billing.infra.repository.ChargeReceiptRepository;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * JPA ledger adapter. Receipt insert and balance debit share one transaction; duplicates are
 * detected by the unique index on {@code (source_system, source_reference)}.
 */
@Slf4j
@Service
public class JpaAccountService implements AccountService {

    static final int ID_COLUMN_LENGTH = 64;
    static final int CALL_ID_COLUMN_LENGTH = 128;
    static final int SOURCE_REFERENCE_COLUMN_LENGTH = 255;

    private final ChargeReceiptRepository chargeReceiptRepository;
    private final BillingAccountRepository billingAccountRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JpaAccountService(ChargeReceiptRepository chargeReceiptRepository,
                             BillingAccountRepository billingAccountRepository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.chargeReceiptRepository = chargeReceiptRepository;
        this.billingAccountRepository = billingAccountRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public long getBalance(String billingAccountId) {
        return billingAccountRepository.findById(billingAccountId)
                .map(BillingAccount::getBalanceCredits)
                .orElseThrow(() -> new AccountNotFoundException(billingAccountId));
    }

    @Override
    public ReceiptWriteResult recordChargeReceipt(ChargeReceiptParams requested) {
        ChargeReceiptParams params = fitToColumns(requested);
        if (chargeReceiptRepository.existsBySourceSystemAndSourceReference(params.sourceSystem(), params.sourceReference())) {
            log.info("Charge receipt already recorded sourceSystem={} sourceReference={}",
                    params.sourceSystem().wireName(), params.sourceReference());
            return ReceiptWriteResult.DUPLICATE;
        }

        try {
            transactionTemplate.executeWithoutResult(status -> insertAndDebit(params));
            return ReceiptWriteResult.RECORDED;
        } catch (DataIntegrityViolationException e) {
            // Lost a concurrent insert race for the same key
            if (chargeReceiptRepository.existsBySourceSystemAndSourceReference(params.sourceSystem(), params.sourceReference())) {
                log.info("Concurrent duplicate charge receipt sourceSystem={} sourceReference={}",
                        params.sourceSystem().wireName(), params.sourceReference());
                return ReceiptWriteResult.DUPLICATE;
            }
            throw e;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChargeReceipt> findReceiptsForRun(String runId, int attempt) {
        return chargeReceiptRepository.findByRunIdAndAttemptOrderByCreatedAtAsc(fit(runId, ID_COLUMN_LENGTH), attempt);
    }

    private ChargeReceiptParams fitToColumns(ChargeReceiptParams params) {
        ChargeReceiptParams fitted = params.toBuilder()
                .billingAccountId(fit(params.billingAccountId(), ID_COLUMN_LENGTH))
                .virtualKeyId(fit(params.virtualKeyId(), ID_COLUMN_LENGTH))
                .runId(fit(params.runId(), ID_COLUMN_LENGTH))
                .ingressRequestId(fit(params.ingressRequestId(), ID_COLUMN_LENGTH))
                .litellmCallId(fit(params.litellmCallId(), CALL_ID_COLUMN_LENGTH))
                .sourceReference(fit(params.sourceReference(), SOURCE_REFERENCE_COLUMN_LENGTH))
                .build();
        if (!fitted.equals(params)) {
            log.warn("Shortened over-long receipt identifiers runId={} sourceReference={}",
                    fitted.runId(), fitted.sourceReference());
        }
        return fitted;
    }

    /**
     * Values longer than their column keep a prefix plus the MD5 of the full value. The result is
     * deterministic, so a shortened idempotency key still deduplicates.
     */
    static String fit(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        String digest = DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
        return value.substring(0, maxLength - digest.length() - 1) + "#" + digest;
    }

    private void insertAndDebit(ChargeReceiptParams params) {
        chargeReceiptRepository.saveAndFlush(toEntity(params));

        if (params.chargedCredits() > 0) {
            int updated = billingAccountRepository.debit(params.billingAccountId(), params.chargedCredits());
            if (updated == 0) {
                log.warn("Receipt recorded for unknown billing account {}; balance not debited (sourceReference={})",
                        params.billingAccountId(), params.sourceReference());
            }
        }
    }

    private ChargeReceipt toEntity(ChargeReceiptParams params) {
        ChargeReceipt receipt = new ChargeReceipt();
        receipt.setBillingAccountId(params.billingAccountId());
        receipt.setVirtualKeyId(params.virtualKeyId());
        receipt.setRunId(params.runId());
        receipt.setAttempt(params.attempt());
        receipt.setIngressRequestId(params.ingressRequestId());
        receipt.setChargedCredits(params.chargedCredits());
        receipt.setResponseCostUsd(params.responseCostUsd());
        receipt.setLitellmCallId(params.litellmCallId());
        receipt.setProvenance(params.provenance());
        receipt.setChargeReason(params.chargeReason());
        receipt.setSourceSystem(params.sourceSystem());
        receipt.setSourceReference(params.sourceReference());
        receipt.setCreatedAt(LocalDateTime.now(clock));
        return receipt;
    }
}
