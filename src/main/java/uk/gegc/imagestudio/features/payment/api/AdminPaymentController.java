package uk.gegc.imagestudio.features.payment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.payment.api.dto.ReconciliationReportDto;
import uk.gegc.imagestudio.features.payment.application.PaymentReconciliationService;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;
import uk.gegc.imagestudio.features.payment.application.ReconciliationReport;

import java.time.Duration;

@RestController
@RequestMapping("/api/v1/admin/payments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Payments Admin", description = "Payment reconciliation")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminPaymentController {

    private final PaymentReconciliationService reconciliationService;
    private final PaystackProperties paystackProperties;

    @Operation(
            summary = "Run payment reconciliation",
            description = "Checks pending payments older than the lookback with Paystack and settles them."
    )
    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationReportDto> reconcile(
            @Parameter(description = "Minutes a payment must have been pending; defaults to the configured lookback")
            @RequestParam(required = false) @Min(0) @Max(43_200) Integer lookbackMinutes) {
        Duration lookback = lookbackMinutes == null
                ? paystackProperties.getReconcileLookback()
                : Duration.ofMinutes(lookbackMinutes);
        ReconciliationReport report = reconciliationService.reconcile(lookback);
        return ResponseEntity.ok(new ReconciliationReportDto(report.examined(), report.reconciledCount(),
                report.failedCount(), report.skipped(), report.errors()));
    }
}
