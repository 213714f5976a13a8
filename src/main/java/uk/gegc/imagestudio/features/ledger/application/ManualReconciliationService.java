package uk.gegc.imagestudio.features.ledger.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.imagestudio.features.ledger.api.dto.ManualReconciliationDto;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationStatus;

import java.util.UUID;

/**
 * Queue of ledger movements that need an operator.
 */
public interface ManualReconciliationService {

    /**
     * Opens a record for {@code reference}, or returns the id of the one already open.
     */
    UUID open(String userId, long amount, String reference, String reason);

    Page<ManualReconciliationDto> list(ManualReconciliationStatus status, String userId, Pageable pageable);

    ManualReconciliationDto resolve(UUID id, String adminUserId, String note);
}
