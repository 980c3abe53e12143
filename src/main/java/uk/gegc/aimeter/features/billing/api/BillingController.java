package uk.gegc.aimeter.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.aimeter.features.ai.domain.model.CallerIdentity;
import uk.gegc.aimeter.features.billing.api.dto.ActivityDto;
import uk.gegc.aimeter.features.billing.api.dto.BalanceDto;
import uk.gegc.aimeter.features.billing.api.dto.ChargeReceiptDto;
import uk.gegc.aimeter.features.billing.application.AccountService;
import uk.gegc.aimeter.features.billing.application.ActivityQuery;
import uk.gegc.aimeter.features.billing.application.UsageActivityService;
import uk.gegc.aimeter.features.billing.infra.mapping.ChargeReceiptMapper;
import uk.gegc.aimeter.shared.web.CallerIdentityResolver;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "Credit balance and charge receipts")
public class BillingController {

    private final AccountService accountService;
    private final UsageActivityService usageActivityService;
    private final ChargeReceiptMapper chargeReceiptMapper;
    private final CallerIdentityResolver callerIdentityResolver;

    @Operation(summary = "Get the caller's cached credit balance")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance returned",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "Missing caller identity headers"),
            @ApiResponse(responseCode = "404", description = "Unknown billing account")
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(HttpServletRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(request);
        long balance = accountService.getBalance(caller.billingAccountId());
        return ResponseEntity.ok(new BalanceDto(caller.billingAccountId(), balance));
    }

    @Operation(
            summary = "List charge receipts of a run",
            description = "Reconciliation query by run id and attempt. Only receipts of the caller's billing account are returned."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Receipts returned",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = ChargeReceiptDto.class)))),
            @ApiResponse(responseCode = "401", description = "Missing caller identity headers")
    })
    @GetMapping("/runs/{runId}/receipts")
    public ResponseEntity<List<ChargeReceiptDto>> getRunReceipts(
            @PathVariable String runId,
            @Parameter(description = "Run attempt, currently always 0")
            @RequestParam(defaultValue = "0") int attempt,
            HttpServletRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(request);
        List<ChargeReceiptDto> receipts = chargeReceiptMapper.toDtos(
                accountService.findReceiptsForRun(runId, attempt).stream()
                        .filter(receipt -> caller.billingAccountId().equals(receipt.getBillingAccountId()))
                        .toList());
        return ResponseEntity.ok(receipts);
    }

    @Operation(
            summary = "Get usage activity",
            description = "Spend, credits and request counts per day or hour, plus a newest-first page of receipts. "
                    + "Defaults to the last 30 days grouped by day."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Activity returned",
                    content = @Content(schema = @Schema(implementation = ActivityDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid window, grouping, cursor or limit"),
            @ApiResponse(responseCode = "401", description = "Missing caller identity headers")
    })
    @GetMapping("/activity")
    public ResponseEntity<ActivityDto> getActivity(
            @Parameter(description = "Inclusive window start (ISO date-time)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @Parameter(description = "Exclusive window end (ISO date-time), defaults to now")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @Parameter(description = "Bucket width: day or hour")
            @RequestParam(required = false) String groupBy,
            @Parameter(description = "nextCursor of the previous page")
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Rows per page")
            @RequestParam(required = false) Integer limit,
            HttpServletRequest request) {
        CallerIdentity caller = callerIdentityResolver.resolve(request);
        return ResponseEntity.ok(usageActivityService.getActivity(
                new ActivityQuery(caller.billingAccountId(), from, to, groupBy, cursor, limit)));
    }
}
