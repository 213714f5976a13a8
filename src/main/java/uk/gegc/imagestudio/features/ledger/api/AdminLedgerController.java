package uk.gegc.imagestudio.features.ledger.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import uk.gegc.imagestudio.features.ledger.api.dto.AdjustCreditsRequest;
import uk.gegc.imagestudio.features.ledger.api.dto.AdjustmentResultDto;
import uk.gegc.imagestudio.features.ledger.api.dto.IntegrityReportDto;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.api.dto.ManualReconciliationDto;
import uk.gegc.imagestudio.features.ledger.api.dto.ResolveReconciliationRequest;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.LedgerIntegrityService;
import uk.gegc.imagestudio.features.ledger.application.ManualReconciliationService;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationStatus;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger Admin", description = "Credit adjustments, integrity checks and the manual reconciliation queue")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminLedgerController {

    private final CreditLedgerService creditLedgerService;
    private final LedgerIntegrityService integrityService;
    private final ManualReconciliationService manualReconciliationService;

    @Operation(
            summary = "Adjust a user's credits",
            description = "Positive amounts add credits, negative amounts remove them. Repeating the idempotency key is safe."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Adjustment applied or already applied",
                    content = @Content(schema = @Schema(implementation = AdjustmentResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Negative adjustment would overdraw the account",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Idempotency key already used for something else",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/adjustments")
    public ResponseEntity<AdjustmentResultDto> adjust(@Valid @RequestBody AdjustCreditsRequest request,
                                                      @AuthenticationPrincipal AuthenticatedIdentity admin) {
        return ResponseEntity.ok(creditLedgerService.adjust(
                admin.userId(), request.userId(), request.amount(), request.reason(), request.idempotencyKey()));
    }

    @Operation(summary = "List a user's ledger entries")
    @GetMapping("/{userId}/entries")
    public ResponseEntity<Page<LedgerEntryDto>> entries(@PathVariable String userId,
                                                        @PageableDefault(size = 50) Pageable pageable) {
        return ResponseEntity.ok(creditLedgerService.listEntries(userId, null, null, null, null, null, pageable));
    }

    @Operation(summary = "Verify a user's balance against their entries")
    @GetMapping("/{userId}/integrity")
    public ResponseEntity<IntegrityReportDto> integrity(@PathVariable String userId) {
        return ResponseEntity.ok(integrityService.verifyAccount(userId));
    }

    @Operation(summary = "List manual reconciliation records", description = "Newest first; filter by status or user")
    @GetMapping("/manual-reconciliations")
    public ResponseEntity<Page<ManualReconciliationDto>> manualReconciliations(
            @RequestParam(required = false) ManualReconciliationStatus status,
            @RequestParam(required = false) String userId,
            @PageableDefault(size = 50) Pageable pageable) {
        return ResponseEntity.ok(manualReconciliationService.list(status, userId, pageable));
    }

    @Operation(summary = "Resolve a manual reconciliation record")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Record resolved"),
            @ApiResponse(responseCode = "404", description = "Record not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Record already resolved",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/manual-reconciliations/{id}/resolve")
    public ResponseEntity<ManualReconciliationDto> resolve(@PathVariable UUID id,
                                                           @Valid @RequestBody ResolveReconciliationRequest request,
                                                           @AuthenticationPrincipal AuthenticatedIdentity admin) {
        return ResponseEntity.ok(manualReconciliationService.resolve(id, admin.userId(), request.note()));
    }
}
