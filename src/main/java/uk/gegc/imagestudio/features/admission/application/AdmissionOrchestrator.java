package uk.gegc.imagestudio.features.admission.application;

import uk.gegc.imagestudio.features.admission.api.dto.AdmissionDto;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Instant;
import java.util.UUID;

/**
 * Gatekeeper in front of every paid image operation: rate limit, then content policy, then charge.
 * The first denial ends the attempt, and every attempt leaves exactly one summary audit record.
 */
public interface AdmissionOrchestrator {

    AdmissionResult admit(AuthenticatedIdentity identity, AdmissionRequest request);

    /**
     * Reports how the external operation ended. A failure refunds the charge. Repeated reports
     * return the admission unchanged.
     */
    AdmissionDto reportOutcome(UUID admissionId, AuthenticatedIdentity identity, boolean succeeded, String failureReason);

    AdmissionDto getAdmission(UUID admissionId, AuthenticatedIdentity identity);

    /**
     * Compensates admissions whose outcome never arrived and finishes refunds interrupted mid-way.
     *
     * @return number of admissions compensated
     */
    int expireStaleAdmissions(Instant now);
}
