package uk.gegc.aimeter.features.billing.domain.model;

import java.time.temporal.ChronoUnit;

/**
 * Bucket width of the activity chart series.
 */
public enum ActivityGrouping {
    DAY(ChronoUnit.DAYS),
    HOUR(ChronoUnit.HOURS);

    private final ChronoUnit unit;

    ActivityGrouping(ChronoUnit unit) {
        this.unit = unit;
    }

    public ChronoUnit unit() {
        return unit;
    }
}
