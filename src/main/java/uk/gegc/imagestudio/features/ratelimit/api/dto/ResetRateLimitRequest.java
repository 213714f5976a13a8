package uk.gegc.imagestudio.features.ratelimit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ResetRateLimitRequest")
public record ResetRateLimitRequest(
        @Schema(description = "User whose window is reset", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String userId,

        @Schema(description = "Operation class to reset", example = "generation", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank String operationClass
) {}
