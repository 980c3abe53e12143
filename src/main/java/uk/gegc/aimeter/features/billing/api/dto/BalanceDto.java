package uk.gegc.aimeter.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "BalanceDto", description = "Cached credit balance of a billing account")
public record BalanceDto(
        @Schema(description = "Billing account id")
        String billingAccountId,

        @Schema(description = "Balance in credits, negative when usage exceeded the advisory check", example = "10000")
        long balanceCredits
) {}
