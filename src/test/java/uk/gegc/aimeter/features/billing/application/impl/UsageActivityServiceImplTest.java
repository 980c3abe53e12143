package uk.gegc.aimeter.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.aimeter.features.billing.api.dto.ActivityBucketDto;
import uk.gegc.aimeter.features.billing.api.dto.ActivityDto;
import uk.gegc.aimeter.features.billing.api.dto.ChargeReceiptDto;
import uk.gegc.aimeter.features.billing.application.ActivityQuery;
import uk.gegc.aimeter.features.billing.application.BillingProperties;
import uk.gegc.aimeter.features.billing.domain.exception.InvalidActivityQueryException;
import uk.gegc.aimeter.features.billing.domain.model.ActivityGrouping;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReason;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;
import uk.gegc.aimeter.features.billing.infra.mapping.ChargeReceiptMapperImpl;
import uk.gegc.aimeter.features.billing.infra.repository.ChargeReceiptRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import({UsageActivityServiceImpl.class, ChargeReceiptMapperImpl.class, UsageActivityServiceImplTest.ActivityTestConfig.class})
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create"
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("UsageActivityServiceImpl")
class UsageActivityServiceImplTest {

    private static final LocalDateTime JAN_14 = LocalDateTime.of(2025, 1, 14, 0, 0);
    private static final LocalDateTime JAN_16 = LocalDateTime.of(2025, 1, 16, 0, 0);

    @TestConfiguration
    static class ActivityTestConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC);
        }

        @Bean
        BillingProperties billingProperties() {
            return new BillingProperties();
        }
    }

    @Autowired
    private UsageActivityServiceImpl activityService;

    @Autowired
    private ChargeReceiptRepository chargeReceiptRepository;

    @BeforeEach
    void setUp() {
        chargeReceiptRepository.deleteAll();
        save("acct-1", "run_a/0/call-1", LocalDateTime.of(2025, 1, 14, 9, 0), 100L, new BigDecimal("0.01"));
        save("acct-1", "run_a/0/call-2", LocalDateTime.of(2025, 1, 14, 15, 0), 200L, null);
        save("acct-1", "run_b/0/call-1", LocalDateTime.of(2025, 1, 15, 8, 0), 300L, new BigDecimal("0.03"));
        save("acct-2", "run_c/0/call-1", LocalDateTime.of(2025, 1, 14, 10, 0), 999L, new BigDecimal("9.99"));
        save("acct-1", "run_old/0/call-1", LocalDateTime.of(2024, 11, 1, 12, 0), 50L, new BigDecimal("0.50"));
    }

    private void save(String accountId, String sourceReference, LocalDateTime createdAt, long credits, BigDecimal cost) {
        ChargeReceipt receipt = new ChargeReceipt();
        receipt.setBillingAccountId(accountId);
        receipt.setVirtualKeyId("vk-1");
        receipt.setRunId(sourceReference.substring(0, sourceReference.indexOf('/')));
        receipt.setAttempt(0);
        receipt.setChargedCredits(credits);
        receipt.setResponseCostUsd(cost);
        receipt.setProvenance(ChargeProvenance.STREAM);
        receipt.setChargeReason(ChargeReason.LLM_USAGE);
        receipt.setSourceSystem(SourceSystem.LITELLM);
        receipt.setSourceReference(sourceReference);
        receipt.setCreatedAt(createdAt);
        chargeReceiptRepository.save(receipt);
    }

    private static ActivityQuery query(LocalDateTime from, LocalDateTime to, String groupBy, String cursor, Integer limit) {
        return new ActivityQuery("acct-1", from, to, groupBy, cursor, limit);
    }

    @Nested
    @DisplayName("Chart series and totals")
    class Aggregation {

        @Test
        @DisplayName("Daily buckets sum spend, credits and requests of the caller's account only")
        void dailyBuckets() {
            ActivityDto activity = activityService.getActivity(query(JAN_14, JAN_16, "day", null, null));

            assertThat(activity.groupBy()).isEqualTo(ActivityGrouping.DAY);
            assertThat(activity.chartSeries()).extracting(ActivityBucketDto::bucketStart)
                    .containsExactly(JAN_14, JAN_14.plusDays(1));

            ActivityBucketDto first = activity.chartSeries().get(0);
            assertThat(first.requests()).isEqualTo(2);
            assertThat(first.credits()).isEqualTo(300);
            assertThat(first.spendUsd()).isEqualByComparingTo("0.01");

            assertThat(activity.totals().requests()).isEqualTo(3);
            assertThat(activity.totals().credits()).isEqualTo(600);
            assertThat(activity.totals().spendUsd()).isEqualByComparingTo("0.04");
        }

        @Test
        @DisplayName("Hourly buckets include empty hours")
        void hourlyBuckets() {
            ActivityDto activity = activityService.getActivity(query(
                    LocalDateTime.of(2025, 1, 14, 9, 0), LocalDateTime.of(2025, 1, 14, 12, 0), "HOUR", null, null));

            assertThat(activity.chartSeries()).extracting(ActivityBucketDto::requests)
                    .containsExactly(1L, 0L, 0L);
        }

        @Test
        @DisplayName("Without from and to the window is the last 30 days by day")
        void defaultWindow() {
            ActivityDto activity = activityService.getActivity(query(null, null, null, null, null));

            assertThat(activity.to()).isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 0));
            assertThat(activity.from()).isEqualTo(LocalDateTime.of(2024, 12, 16, 10, 0));
            assertThat(activity.chartSeries()).hasSize(31);
            assertThat(activity.chartSeries().get(0).bucketStart()).isEqualTo(LocalDateTime.of(2024, 12, 16, 0, 0));
            assertThat(activity.totals().requests()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Rows")
    class Rows {

        @Test
        @DisplayName("Pages newest first and the cursor continues where the last page stopped")
        void cursorPaging() {
            ActivityDto first = activityService.getActivity(query(JAN_14, JAN_16, "day", null, 2));

            assertThat(first.rows()).extracting(ChargeReceiptDto::sourceReference)
                    .containsExactly("run_b/0/call-1", "run_a/0/call-2");
            assertThat(first.nextCursor()).isNotBlank();

            ActivityDto second = activityService.getActivity(query(JAN_14, JAN_16, "day", first.nextCursor(), 2));

            assertThat(second.rows()).extracting(ChargeReceiptDto::sourceReference)
                    .containsExactly("run_a/0/call-1");
            assertThat(second.nextCursor()).isNull();
            assertThat(second.totals().requests()).isEqualTo(3);
        }

        @Test
        @DisplayName("Receipts sharing a timestamp are neither skipped nor repeated across pages")
        void sameTimestampAcrossPages() {
            LocalDateTime at = LocalDateTime.of(2025, 1, 15, 9, 0);
            save("acct-1", "run_t/0/call-1", at, 1L, null);
            save("acct-1", "run_t/0/call-2", at, 1L, null);
            LocalDateTime from = LocalDateTime.of(2025, 1, 15, 8, 30);
            LocalDateTime to = LocalDateTime.of(2025, 1, 15, 9, 30);

            ActivityDto first = activityService.getActivity(query(from, to, "hour", null, 1));
            ActivityDto second = activityService.getActivity(query(from, to, "hour", first.nextCursor(), 1));

            assertThat(first.rows()).hasSize(1);
            assertThat(second.rows()).hasSize(1);
            assertThat(second.nextCursor()).isNull();
            assertThat(first.rows().get(0).id()).isNotEqualTo(second.rows().get(0).id());
        }

        @Test
        @DisplayName("Cursor round-trips its timestamp and id")
        void cursorEncoding() {
            UUID id = UUID.randomUUID();
            LocalDateTime at = LocalDateTime.of(2025, 1, 14, 15, 0, 1, 500_000_000);

            UsageActivityServiceImpl.Cursor cursor =
                    UsageActivityServiceImpl.decodeCursor(UsageActivityServiceImpl.encodeCursor(at, id));

            assertThat(cursor.createdAt()).isEqualTo(at);
            assertThat(cursor.id()).isEqualTo(id);
        }
    }

    @Nested
    @DisplayName("Rejected queries")
    class Rejected {

        @Test
        @DisplayName("from not before to")
        void emptyWindow() {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_16, JAN_14, "day", null, null)))
                    .isInstanceOf(InvalidActivityQueryException.class)
                    .hasMessage("from must be before to");
        }

        @Test
        @DisplayName("Window wider than 90 days")
        void dailyWindowTooWide() {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_16.minusDays(91), JAN_16, "day", null, null)))
                    .isInstanceOf(InvalidActivityQueryException.class)
                    .hasMessageContaining("90 days");
        }

        @Test
        @DisplayName("Hourly window wider than 7 days")
        void hourlyWindowTooWide() {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_16.minusDays(8), JAN_16, "hour", null, null)))
                    .isInstanceOf(InvalidActivityQueryException.class)
                    .hasMessageContaining("7 days");
        }

        @Test
        @DisplayName("Unknown grouping")
        void unknownGrouping() {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_14, JAN_16, "week", null, null)))
                    .isInstanceOf(InvalidActivityQueryException.class);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 101})
        @DisplayName("Limit out of range")
        void limitOutOfRange(int limit) {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_14, JAN_16, "day", null, limit)))
                    .isInstanceOf(InvalidActivityQueryException.class)
                    .hasMessage("limit must be between 1 and 100");
        }

        @ParameterizedTest
        @ValueSource(strings = {"%%%", "bm8tc2VwYXJhdG9y", "MjAyNS0wMS0xNHxub3QtYS11dWlk"})
        @DisplayName("Malformed cursor")
        void malformedCursor(String cursor) {
            assertThatThrownBy(() -> activityService.getActivity(query(JAN_14, JAN_16, "day", cursor, null)))
                    .isInstanceOf(InvalidActivityQueryException.class)
                    .hasMessage("Malformed cursor");
        }
    }
}
