package uk.gegc.aimeter.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.aimeter.features.billing.domain.model.ActivityGrouping;

import java.time.LocalDateTime;
import java.util.List;

@Schema(name = "ActivityDto", description = "Usage activity of the caller's billing account")
public record ActivityDto(
        LocalDateTime from,
        LocalDateTime to,
        ActivityGrouping groupBy,

        @Schema(description = "One bucket per day or hour of the window, empty buckets included")
        List<ActivityBucketDto> chartSeries,

        ActivityTotalsDto totals,

        @Schema(description = "Receipts of the window, newest first")
        List<ChargeReceiptDto> rows,

        @Schema(description = "Pass back as cursor to fetch the next page; absent on the last page")
        String nextCursor
) {}
