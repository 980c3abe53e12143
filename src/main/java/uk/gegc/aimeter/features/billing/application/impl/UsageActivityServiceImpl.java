package uk.gegc.aimeter.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aimeter.features.billing.api.dto.ActivityBucketDto;
import uk.gegc.aimeter.features.billing.api.dto.ActivityDto;
import uk.gegc.aimeter.features.billing.api.dto.ActivityTotalsDto;
import uk.gegc.aimeter.features.billing.application.ActivityQuery;
import uk.gegc.aimeter.features.billing.application.BillingProperties;
import uk.gegc.aimeter.features.billing.application.UsageActivityService;
import uk.gegc.aimeter.features.billing.domain.exception.InvalidActivityQueryException;
import uk.gegc.aimeter.features.billing.domain.model.ActivityGrouping;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.infra.mapping.ChargeReceiptMapper;
import uk.gegc.aimeter.features.billing.infra.repository.ChargeReceiptRepository;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the activity report from charge receipts. Buckets are aggregated in memory over the
 * bounded window; rows are paged with a {@code (createdAt, id)} keyset cursor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageActivityServiceImpl implements UsageActivityService {

    static final int DEFAULT_LIMIT = 20;

    private final ChargeReceiptRepository chargeReceiptRepository;
    private final ChargeReceiptMapper chargeReceiptMapper;
    private final BillingProperties billingProperties;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public ActivityDto getActivity(ActivityQuery query) {
        ActivityGrouping grouping = parseGrouping(query.groupBy());
        LocalDateTime to = query.to() != null ? query.to() : LocalDateTime.now(clock);
        LocalDateTime from = query.from() != null
                ? query.from()
                : to.minusDays(billingProperties.getActivityDefaultRangeDays());
        validateWindow(from, to, grouping);
        int limit = resolveLimit(query.limit());
        Cursor after = query.cursor() == null || query.cursor().isBlank() ? null : decodeCursor(query.cursor());

        List<ChargeReceipt> inWindow = chargeReceiptRepository
                .findByBillingAccountIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtAsc(
                        query.billingAccountId(), from, to);

        List<ChargeReceipt> page = chargeReceiptRepository.findActivityPage(
                query.billingAccountId(), from, to,
                after != null ? after.createdAt() : null,
                after != null ? after.id() : null,
                PageRequest.of(0, limit + 1));
        String nextCursor = null;
        if (page.size() > limit) {
            page = page.subList(0, limit);
            ChargeReceipt last = page.get(limit - 1);
            nextCursor = encodeCursor(last.getCreatedAt(), last.getId());
        }

        log.debug("Activity for account {} in [{}, {}) by {}: {} receipts, page of {}",
                query.billingAccountId(), from, to, grouping, inWindow.size(), page.size());

        return new ActivityDto(
                from,
                to,
                grouping,
                buckets(inWindow, from, to, grouping),
                totals(inWindow),
                chargeReceiptMapper.toDtos(page),
                nextCursor);
    }

    private ActivityGrouping parseGrouping(String groupBy) {
        if (groupBy == null || groupBy.isBlank()) {
            return ActivityGrouping.DAY;
        }
        try {
            return ActivityGrouping.valueOf(groupBy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidActivityQueryException("groupBy must be one of day, hour");
        }
    }

    private void validateWindow(LocalDateTime from, LocalDateTime to, ActivityGrouping grouping) {
        if (!from.isBefore(to)) {
            throw new InvalidActivityQueryException("from must be before to");
        }
        int maxDays = grouping == ActivityGrouping.HOUR
                ? billingProperties.getActivityMaxHourlyRangeDays()
                : billingProperties.getActivityMaxRangeDays();
        if (Duration.between(from, to).compareTo(Duration.ofDays(maxDays)) > 0) {
            throw new InvalidActivityQueryException(
                    "Window exceeds " + maxDays + " days for groupBy " + grouping.name().toLowerCase(Locale.ROOT));
        }
    }

    private int resolveLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        int max = billingProperties.getActivityMaxPageSize();
        if (limit < 1 || limit > max) {
            throw new InvalidActivityQueryException("limit must be between 1 and " + max);
        }
        return limit;
    }

    private static List<ActivityBucketDto> buckets(List<ChargeReceipt> receipts,
                                                   LocalDateTime from,
                                                   LocalDateTime to,
                                                   ActivityGrouping grouping) {
        Map<LocalDateTime, Accumulator> byStart = new LinkedHashMap<>();
        for (LocalDateTime start = from.truncatedTo(grouping.unit()); start.isBefore(to);
             start = start.plus(1, grouping.unit())) {
            byStart.put(start, new Accumulator());
        }
        for (ChargeReceipt receipt : receipts) {
            byStart.get(receipt.getCreatedAt().truncatedTo(grouping.unit())).add(receipt);
        }
        List<ActivityBucketDto> series = new ArrayList<>(byStart.size());
        byStart.forEach((start, acc) -> series.add(
                new ActivityBucketDto(start, acc.spendUsd, acc.credits, acc.requests)));
        return series;
    }

    private static ActivityTotalsDto totals(List<ChargeReceipt> receipts) {
        Accumulator acc = new Accumulator();
        receipts.forEach(acc::add);
        return new ActivityTotalsDto(acc.spendUsd, acc.credits, acc.requests);
    }

    static String encodeCursor(LocalDateTime createdAt, UUID id) {
        String raw = createdAt + "|" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    static Cursor decodeCursor(String cursor) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
            int separator = raw.indexOf('|');
            if (separator < 0) {
                throw new InvalidActivityQueryException("Malformed cursor");
            }
            return new Cursor(LocalDateTime.parse(raw.substring(0, separator)),
                    UUID.fromString(raw.substring(separator + 1)));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidActivityQueryException("Malformed cursor");
        }
    }

    record Cursor(LocalDateTime createdAt, UUID id) {
    }

    private static final class Accumulator {
        private BigDecimal spendUsd = BigDecimal.ZERO;
        private long credits;
        private long requests;

        void add(ChargeReceipt receipt) {
            if (receipt.getResponseCostUsd() != null) {
                spendUsd = spendUsd.add(receipt.getResponseCostUsd());
            }
            credits += receipt.getChargedCredits();
            requests++;
        }
    }
}
