package uk.gegc.aimeter.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReason;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "ChargeReceiptDto", description = "One billed unit of usage")
public record ChargeReceiptDto(
        UUID id,
        String billingAccountId,
        String virtualKeyId,
        String runId,
        int attempt,
        String ingressRequestId,

        @Schema(description = "Credits debited for this unit", example = "2")
        long chargedCredits,

        @Schema(description = "User-facing price in USD, absent when cost was not reported")
        BigDecimal responseCostUsd,

        String litellmCallId,
        ChargeProvenance provenance,
        ChargeReason chargeReason,
        SourceSystem sourceSystem,

        @Schema(description = "Idempotency key within the source system", example = "run_1/0/call-1")
        String sourceReference,

        LocalDateTime createdAt
) {}
