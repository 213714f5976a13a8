package uk.gegc.imagestudio.features.payment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.payment.api.dto.CheckoutRequest;
import uk.gegc.imagestudio.features.payment.api.dto.CheckoutResponse;
import uk.gegc.imagestudio.features.payment.api.dto.SubscriptionDto;
import uk.gegc.imagestudio.features.payment.application.CheckoutService;
import uk.gegc.imagestudio.features.payment.application.SubscriptionService;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.util.List;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Buy credits and manage subscriptions")
@SecurityRequirement(name = "Bearer Authentication")
public class CheckoutController {

    private static final String BILLING_OPERATION = "billing";

    private final CheckoutService checkoutService;
    private final SubscriptionService subscriptionService;
    private final RateLimiterService rateLimiterService;

    @Operation(
            summary = "Start checkout",
            description = "Opens a Paystack transaction for a credit package or plan. Redirect the customer to the "
                    + "returned authorization URL; credits are added once the payment succeeds."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Checkout started",
                    content = @Content(schema = @Schema(implementation = CheckoutResponse.class))),
            @ApiResponse(responseCode = "400", description = "Unknown product or no e-mail available",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many billing requests",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Paystack unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(@Valid @RequestBody CheckoutRequest request,
                                                     @AuthenticationPrincipal AuthenticatedIdentity identity) {
        rateLimiterService.enforce(identity, BILLING_OPERATION);
        return ResponseEntity.ok(checkoutService.initiate(identity, request));
    }

    @Operation(summary = "List subscriptions",
            description = "Returns the caller's subscriptions, newest first. Administrators may pass userId.")
    @GetMapping("/subscriptions")
    public ResponseEntity<List<SubscriptionDto>> subscriptions(
            @RequestParam(required = false) String userId,
            @AuthenticationPrincipal AuthenticatedIdentity identity) {
        rateLimiterService.enforce(identity, BILLING_OPERATION);
        return ResponseEntity.ok(subscriptionService.listForUser(identity.resolveTargetUser(userId)));
    }
}
