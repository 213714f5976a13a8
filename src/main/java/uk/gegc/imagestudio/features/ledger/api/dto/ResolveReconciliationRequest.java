package uk.gegc.imagestudio.features.ledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveReconciliationRequest(
        @NotBlank @Size(max = 1000) String note
) {}
