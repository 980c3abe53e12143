package uk.gegc.aimeter.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Schema(name = "ActivityBucketDto", description = "Usage aggregated over one chart bucket")
public record ActivityBucketDto(
        @Schema(description = "Inclusive start of the bucket")
        LocalDateTime bucketStart,

        @Schema(description = "User-facing spend in USD, receipts without a reported cost count as zero", example = "0.0042")
        BigDecimal spendUsd,

        @Schema(description = "Credits debited", example = "42000")
        long credits,

        @Schema(description = "Number of charge receipts", example = "3")
        long requests
) {}
