package uk.gegc.aimeter.features.billing.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.aimeter.features.billing.api.dto.ActivityBucketDto;
import uk.gegc.aimeter.features.billing.api.dto.ActivityDto;
import uk.gegc.aimeter.features.billing.api.dto.ActivityTotalsDto;
import uk.gegc.aimeter.features.billing.api.dto.ChargeReceiptDto;
import uk.gegc.aimeter.features.billing.application.AccountService;
import uk.gegc.aimeter.features.billing.application.ActivityQuery;
import uk.gegc.aimeter.features.billing.application.UsageActivityService;
import uk.gegc.aimeter.features.billing.domain.exception.AccountNotFoundException;
import uk.gegc.aimeter.features.billing.domain.exception.InvalidActivityQueryException;
import uk.gegc.aimeter.features.billing.domain.model.ActivityGrouping;
import uk.gegc.aimeter.features.billing.domain.model.ChargeProvenance;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReason;
import uk.gegc.aimeter.features.billing.domain.model.ChargeReceipt;
import uk.gegc.aimeter.features.billing.domain.model.SourceSystem;
import uk.gegc.aimeter.features.billing.infra.mapping.ChargeReceiptMapperImpl;
import uk.gegc.aimeter.shared.web.CallerIdentityResolver;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BillingController.class)
@Import({CallerIdentityResolver.class, ChargeReceiptMapperImpl.class})
class BillingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AccountService accountService;

    @MockitoBean
    private UsageActivityService usageActivityService;

    private static ChargeReceipt receipt(String accountId, String sourceReference) {
        ChargeReceipt receipt = new ChargeReceipt();
        receipt.setId(UUID.randomUUID());
        receipt.setBillingAccountId(accountId);
        receipt.setVirtualKeyId("vk-1");
        receipt.setRunId("run_1");
        receipt.setAttempt(0);
        receipt.setChargedCredits(2L);
        receipt.setProvenance(ChargeProvenance.STREAM);
        receipt.setChargeReason(ChargeReason.LLM_USAGE);
        receipt.setSourceSystem(SourceSystem.LITELLM);
        receipt.setSourceReference(sourceReference);
        receipt.setCreatedAt(LocalDateTime.of(2025, 1, 15, 10, 0));
        return receipt;
    }

    @Test
    @DisplayName("GET /balance: returns the caller's cached balance")
    void balance() throws Exception {
        when(accountService.getBalance("acct-1")).thenReturn(1234L);

        mockMvc.perform(get("/api/v1/billing/balance")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.billingAccountId").value("acct-1"))
                .andExpect(jsonPath("$.balanceCredits").value(1234));
    }

    @Test
    @DisplayName("GET /balance: unknown account returns 404")
    void balance_unknownAccount() throws Exception {
        when(accountService.getBalance("ghost")).thenThrow(new AccountNotFoundException("ghost"));

        mockMvc.perform(get("/api/v1/billing/balance")
                        .header("X-Billing-Account-Id", "ghost")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /runs/{runId}/receipts: returns only the caller's receipts with wire names")
    void runReceipts_filteredByAccount() throws Exception {
        when(accountService.findReceiptsForRun("run_1", 0)).thenReturn(List.of(
                receipt("acct-1", "run_1/0/call-1"),
                receipt("acct-2", "run_1/0/call-2")));

        mockMvc.perform(get("/api/v1/billing/runs/run_1/receipts")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].sourceReference").value("run_1/0/call-1"))
                .andExpect(jsonPath("$[0].sourceSystem").value("litellm"))
                .andExpect(jsonPath("$[0].chargeReason").value("llm_usage"))
                .andExpect(jsonPath("$[0].provenance").value("stream"));
    }

    @Test
    @DisplayName("GET /runs/{runId}/receipts: non-numeric attempt returns 400")
    void runReceipts_badAttempt() throws Exception {
        mockMvc.perform(get("/api/v1/billing/runs/run_1/receipts")
                        .param("attempt", "first")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.parameter").value("attempt"));
    }

    @Test
    @DisplayName("GET /activity: passes the caller's account and query parameters through")
    void activity_returnsReport() throws Exception {
        LocalDateTime from = LocalDateTime.of(2025, 1, 14, 0, 0);
        LocalDateTime to = LocalDateTime.of(2025, 1, 16, 0, 0);
        when(usageActivityService.getActivity(any())).thenReturn(new ActivityDto(
                from, to, ActivityGrouping.DAY,
                List.of(new ActivityBucketDto(from, new BigDecimal("0.0040"), 40_000L, 2L),
                        new ActivityBucketDto(from.plusDays(1), BigDecimal.ZERO, 0L, 0L)),
                new ActivityTotalsDto(new BigDecimal("0.0040"), 40_000L, 2L),
                List.of(mappedRow()),
                "next-page"));

        mockMvc.perform(get("/api/v1/billing/activity")
                        .param("from", "2025-01-14T00:00:00")
                        .param("to", "2025-01-16T00:00:00")
                        .param("groupBy", "day")
                        .param("cursor", "abc")
                        .param("limit", "5")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupBy").value("DAY"))
                .andExpect(jsonPath("$.chartSeries.length()").value(2))
                .andExpect(jsonPath("$.chartSeries[0].requests").value(2))
                .andExpect(jsonPath("$.totals.credits").value(40000))
                .andExpect(jsonPath("$.rows[0].sourceReference").value("run_1/0/call-1"))
                .andExpect(jsonPath("$.nextCursor").value("next-page"));

        ArgumentCaptor<ActivityQuery> captor = ArgumentCaptor.forClass(ActivityQuery.class);
        verify(usageActivityService).getActivity(captor.capture());
        ActivityQuery query = captor.getValue();
        assertThat(query.billingAccountId()).isEqualTo("acct-1");
        assertThat(query.from()).isEqualTo(from);
        assertThat(query.to()).isEqualTo(to);
        assertThat(query.groupBy()).isEqualTo("day");
        assertThat(query.cursor()).isEqualTo("abc");
        assertThat(query.limit()).isEqualTo(5);
    }

    @Test
    @DisplayName("GET /activity: invalid query returns 400 problem")
    void activity_invalidQuery() throws Exception {
        when(usageActivityService.getActivity(any()))
                .thenThrow(new InvalidActivityQueryException("groupBy must be one of day, hour"));

        mockMvc.perform(get("/api/v1/billing/activity")
                        .param("groupBy", "week")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Activity Query"))
                .andExpect(jsonPath("$.detail").value("groupBy must be one of day, hour"));
    }

    @Test
    @DisplayName("GET /activity: unparseable from returns 400 without querying")
    void activity_badDate() throws Exception {
        mockMvc.perform(get("/api/v1/billing/activity")
                        .param("from", "yesterday")
                        .header("X-Billing-Account-Id", "acct-1")
                        .header("X-Virtual-Key-Id", "vk-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(usageActivityService);
    }

    @Test
    @DisplayName("GET /activity: missing identity returns 401")
    void activity_missingIdentity() throws Exception {
        mockMvc.perform(get("/api/v1/billing/activity"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(usageActivityService);
    }

    private static ChargeReceiptDto mappedRow() {
        return new ChargeReceiptMapperImpl().toDto(receipt("acct-1", "run_1/0/call-1"));
    }
}
