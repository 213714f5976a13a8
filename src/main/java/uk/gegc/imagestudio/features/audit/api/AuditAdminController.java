package uk.gegc.imagestudio.features.audit.api;

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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.audit.api.dto.AuditRecordDto;
import uk.gegc.imagestudio.features.audit.api.dto.UserActivitySummaryDto;
import uk.gegc.imagestudio.features.audit.application.AuditQueryService;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;

import java.time.Instant;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/admin/audit")
@RequiredArgsConstructor
@Tag(name = "Audit Admin", description = "Read access to the audit log")
@SecurityRequirement(name = "Bearer Authentication")
public class AuditAdminController {

    private final AuditQueryService auditQueryService;

    @Operation(
            summary = "Search audit records",
            description = "Newest first. All filters are optional; eventType accepts the kebab-case wire name."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Records returned"),
            @ApiResponse(responseCode = "400", description = "Unknown filter value",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an administrator",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<Page<AuditRecordDto>> search(
            @Parameter(description = "Filter by user") @RequestParam(required = false) String userId,
            @Parameter(description = "Filter by event type, e.g. policy-violation") @RequestParam(required = false) String eventType,
            @Parameter(description = "Filter by category") @RequestParam(required = false) String category,
            @Parameter(description = "Filter by severity") @RequestParam(required = false) String severity,
            @Parameter(description = "Inclusive lower bound (ISO-8601)") @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateFrom,
            @Parameter(description = "Inclusive upper bound (ISO-8601)") @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant dateTo,
            @PageableDefault(size = 100) Pageable pageable) {

        AuditEventType type = eventType == null ? null : AuditEventType.fromWireName(eventType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + eventType));

        return ResponseEntity.ok(auditQueryService.search(
                userId,
                type,
                parseEnum(AuditCategory.class, category),
                parseEnum(AuditSeverity.class, severity),
                dateFrom,
                dateTo,
                pageable));
    }

    @Operation(summary = "Activity summary for one user")
    @GetMapping("/users/{userId}/summary")
    public ResponseEntity<UserActivitySummaryDto> summary(@PathVariable String userId) {
        return ResponseEntity.ok(auditQueryService.summarizeUser(userId));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value);
        }
    }
}
