package io.clinic.spi;

import io.clinic.model.ReaccessRequest;
import io.clinic.model.ReaccessRequestView;
import io.clinic.model.ReaccessStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for re-access requests.
 *
 * @see io.clinic.reaccess.ReaccessWorkflow
 */
public interface ReaccessStore {

    /**
     * Inserts a {@code pending} request and returns its id.
     */
    long insert(Connection conn, long patientId, String reason, String contactPhone, Instant submittedAt);

    Optional<ReaccessRequest> findById(Connection conn, long requestId);

    Optional<ReaccessRequest> findByIdForUpdate(Connection conn, long requestId);

    /**
     * Returns the patient's pending request, if any.
     */
    Optional<ReaccessRequest> findPending(Connection conn, long patientId);

    /**
     * Moves a pending request to {@code status} and records who processed it.
     * Rows that are no longer pending are left untouched.
     *
     * @return {@code true} if the request was pending and is now processed
     */
    boolean markProcessed(Connection conn, long requestId, ReaccessStatus status, String adminResponse,
                          long processedBy, Instant processedAt);

    /**
     * Pending requests with patient details, newest first.
     */
    List<ReaccessRequestView> findPendingQueue(Connection conn);

    /**
     * All requests with patient details, newest first.
     */
    List<ReaccessRequestView> findAll(Connection conn);
}
