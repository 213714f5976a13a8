package uk.gegc.imagestudio.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "AdjustCreditsRequest", description = "Manual credit adjustment")
public record AdjustCreditsRequest(
        @Schema(description = "User to adjust", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String userId,

        @Schema(description = "Signed amount: positive adds credits, negative removes them", example = "50",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull Long amount,

        @Schema(description = "Why the adjustment is made", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 500) String reason,

        @Schema(description = "Client-chosen key; repeating it does not apply the adjustment twice",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 200) String idempotencyKey
) {}
