package uk.gegc.aimeter.features.billing.application;

import java.time.LocalDateTime;

/**
 * Raw activity request parameters; every field may be null.
 */
public record ActivityQuery(
        String billingAccountId,
        LocalDateTime from,
        LocalDateTime to,
        String groupBy,
        String cursor,
        Integer limit
) {
}
