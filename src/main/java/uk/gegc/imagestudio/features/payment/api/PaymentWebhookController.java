package uk.gegc.imagestudio.features.payment.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.payment.application.PaymentWebhookService;

@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payment Webhooks", description = "Internal endpoint for Paystack events (not for public use)")
public class PaymentWebhookController {

    private final PaymentWebhookService webhookService;

    @Operation(
            summary = "Handle Paystack webhook",
            description = "Verifies the HMAC-SHA512 signature of the raw body and applies the event. Duplicates and "
                    + "unhandled events are acknowledged with 200."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event applied, duplicate or ignored"),
            @ApiResponse(responseCode = "400", description = "Malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Processing failed; Paystack will redeliver",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/webhook")
    public ResponseEntity<String> handleWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Paystack signature header") @RequestHeader(name = "x-paystack-signature", required = false) String signature) {
        PaymentWebhookService.Result result = webhookService.handle(payload, signature);
        log.debug("Paystack webhook handled with result {}", result);
        return ResponseEntity.ok("");
    }
}
