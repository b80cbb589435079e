package io.clinic.model;

import java.time.Instant;

/**
 * Read-only record representing a persisted re-access request.
 *
 * @param requestId     opaque identifier assigned by the store
 * @param patientId     the appealing patient
 * @param reason        the patient's explanation
 * @param contactPhone  optional contact number
 * @param status        lifecycle state
 * @param adminResponse response text written on adjudication, {@code null} while pending
 * @param submittedAt   submission time
 * @param processedAt   adjudication time, {@code null} while pending
 * @param processedBy   adjudicating admin, {@code null} while pending or when unknown
 */
public record ReaccessRequest(
    long requestId,
    long patientId,
    String reason,
    String contactPhone,
    ReaccessStatus status,
    String adminResponse,
    Instant submittedAt,
    Instant processedAt,
    Long processedBy
) {

    public boolean isPending() {
        return status == ReaccessStatus.PENDING;
    }
}
