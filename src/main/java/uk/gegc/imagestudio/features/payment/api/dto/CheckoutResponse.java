package uk.gegc.imagestudio.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.imagestudio.features.payment.domain.model.CheckoutType;

@Schema(name = "CheckoutResponse", description = "Where to send the customer to pay")
public record CheckoutResponse(
        @Schema(description = "Paystack hosted payment page") String authorizationUrl,
        @Schema(description = "Payment reference; credits are allocated under it") String reference,
        String productId,
        String productName,
        CheckoutType type,
        long credits,
        long price,
        String currency
) {}
