package uk.gegc.imagestudio.features.admission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "AdmitOperationRequest", description = "Request to run one paid image operation")
public record AdmitOperationRequest(
        @Schema(description = "Operation class", example = "edit", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank @Size(max = 64) String operationClass,

        @Schema(description = "Optional cost; only raises the configured cost of the class", example = "5")
        @Positive @Max(10_000) Long cost,

        @Schema(description = "The user's instruction", example = "change hair to auburn",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull @Size(max = 10_000) String instruction,

        @Schema(description = "Faces found in the source image by the detection service", example = "1")
        @Min(0) Integer facesDetected,

        @Schema(description = "Whether the subject's identity must be preserved; defaults to true")
        Boolean preserveIdentity
) {}
