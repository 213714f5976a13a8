package uk.gegc.imagestudio.features.admission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@Schema(name = "ReportOutcomeRequest")
public record ReportOutcomeRequest(
        @Schema(description = "Whether the external operation produced a result", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull Boolean succeeded,

        @Schema(description = "Why it failed; ignored on success")
        @Size(max = 500) String failureReason
) {}
