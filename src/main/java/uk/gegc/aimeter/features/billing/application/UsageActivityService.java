package uk.gegc.aimeter.features.billing.application;

import uk.gegc.aimeter.features.billing.api.dto.ActivityDto;

public interface UsageActivityService {

    /**
     * Chart series, totals and one newest-first page of receipts for an account and window.
     *
     * @throws uk.gegc.aimeter.features.billing.domain.exception.InvalidActivityQueryException
     *         when the window, grouping, cursor or limit is invalid
     */
    ActivityDto getActivity(ActivityQuery query);
}
