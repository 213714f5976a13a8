package uk.gegc.imagestudio.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.imagestudio.features.payment.domain.model.CheckoutType;

@Schema(name = "CheckoutRequest", description = "Start a Paystack checkout for a credit package or plan")
public record CheckoutRequest(
        @Schema(description = "Package id for credit purchases, plan id for subscriptions", example = "starter",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 64) String productId,

        @Schema(description = "credit_purchase or subscription", example = "credit_purchase",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull CheckoutType type,

        @Schema(description = "Billing e-mail; defaults to the e-mail in the identity token")
        @Email @Size(max = 320) String email
) {}
