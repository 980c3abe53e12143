package uk.gegc.aimeter.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "ActivityTotalsDto", description = "Usage totals over the whole window")
public record ActivityTotalsDto(
        BigDecimal spendUsd,
        long credits,
        long requests
) {}
