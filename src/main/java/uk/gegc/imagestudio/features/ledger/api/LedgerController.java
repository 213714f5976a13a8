package uk.gegc.imagestudio.features.ledger.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.ledger.api.dto.BalanceDto;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Credit balance and entry history")
@SecurityRequirement(name = "Bearer Authentication")
public class LedgerController {

    private static final String BILLING_OPERATION = "billing";

    private final CreditLedgerService creditLedgerService;
    private final RateLimiterService rateLimiterService;

    @Operation(
            summary = "Get credit balance",
            description = "Returns the caller's balance. Administrators may pass userId to read another account."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance returned",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "403", description = "Non-admin asked for another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many billing requests",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(
            @Parameter(description = "Target user (admins only)") @RequestParam(required = false) String userId,
            @AuthenticationPrincipal AuthenticatedIdentity identity) {
        rateLimiterService.enforce(identity, BILLING_OPERATION);
        return ResponseEntity.ok(creditLedgerService.getBalance(identity.resolveTargetUser(userId)));
    }

    @Operation(summary = "List ledger entries", description = "The caller's entries, newest first, with optional filters")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entries returned"),
            @ApiResponse(responseCode = "429", description = "Too many billing requests",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/entries")
    public ResponseEntity<Page<LedgerEntryDto>> listEntries(
            @RequestParam(required = false) LedgerEntryKind kind,
            @RequestParam(required = false) LedgerEntrySource source,
            @RequestParam(required = false) LedgerEntryStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateTo,
            @PageableDefault(size = 20) Pageable pageable,
            @AuthenticationPrincipal AuthenticatedIdentity identity) {
        rateLimiterService.enforce(identity, BILLING_OPERATION);
        return ResponseEntity.ok(creditLedgerService.listEntries(
                identity.userId(), kind, source, status, dateFrom, dateTo, pageable));
    }
}
